package com.example.cryptorates.cache;

import com.example.cryptorates.config.CacheProperties;

import java.time.Duration;
import java.time.LocalDate;
import java.util.function.ToIntFunction;

/**
 * 데이터 성격별 TTL 등급
 */
public enum CacheTier {

    /**
     * 최근 24시간, 오늘 - 새 시세가 계속 들어옴
     */
    RECENT(CacheProperties::getRecentTtlSeconds),

    /**
     * 이미 지난 날짜 - 더 이상 변하지 않음
     */
    HISTORICAL(CacheProperties::getHistoricalTtlSeconds),

    /**
     * 거래쌍별 최신 시각 (헬스 체크)
     */
    SNAPSHOT(CacheProperties::getSnapshotTtlSeconds),

    /**
     * 데이터 없음 결과
     */
    NO_DATA(CacheProperties::getNoDataTtlSeconds);

    private final ToIntFunction<CacheProperties> ttlSeconds;

    CacheTier(ToIntFunction<CacheProperties> ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public Duration ttl(CacheProperties properties) {
        return Duration.ofSeconds(ttlSeconds.applyAsInt(properties));
    }

    public static CacheTier forDay(LocalDate date, LocalDate today) {
        return date.isBefore(today) ? HISTORICAL : RECENT;
    }
}
