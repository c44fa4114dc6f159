package com.example.cryptorates.service;

import com.example.cryptorates.cache.CacheKeys;
import com.example.cryptorates.cache.CacheTier;
import com.example.cryptorates.cache.RateCache;
import com.example.cryptorates.config.CacheProperties;
import com.example.cryptorates.config.RateProperties;
import com.example.cryptorates.domain.CryptoPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 시세 캐시 관리 (TTL 등급, 무효화)
 *
 * 무효화 대상: 최근 24시간 키, 오늘 날짜 키, 해당 거래쌍을 포함하는 스냅샷 키.
 * 지난 날짜 키는 내용이 바뀌지 않으므로 무효화하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateCacheService {

    private final RateCache rateCache;
    private final CacheKeys cacheKeys;
    private final CacheProperties cacheProperties;
    private final RateProperties rateProperties;
    private final Clock clock;

    public Duration ttl(CacheTier tier) {
        return tier.ttl(cacheProperties);
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(rateProperties.getZone()));
    }

    public List<String> keysToInvalidate(CryptoPair pair) {
        List<String> keys = new ArrayList<>();
        keys.add(cacheKeys.recent(pair));
        keys.add(cacheKeys.day(pair, today()));
        keys.addAll(cacheKeys.snapshotsContaining(pair));
        return keys;
    }

    /**
     * 새 시세 저장 후 호출. 캐시 오류는 로그만 남긴다.
     */
    public void invalidate(CryptoPair pair) {
        List<String> keys = keysToInvalidate(pair);
        rateCache.delete(keys);
        log.info("[캐시 무효화] pair={}, keys={}", pair.getSymbol(), keys);
    }

    public void invalidateAll() {
        Set<String> keys = new LinkedHashSet<>();
        for (CryptoPair pair : CryptoPair.values()) {
            keys.addAll(keysToInvalidate(pair));
        }
        rateCache.delete(keys);
        log.info("[전체 캐시 무효화] keys={}", keys.size());
    }
}
