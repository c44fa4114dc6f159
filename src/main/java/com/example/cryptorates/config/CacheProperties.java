package com.example.cryptorates.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "cache.rates")
public class CacheProperties {

    /**
     * 최근 구간(24시간, 오늘) TTL (초)
     */
    private int recentTtlSeconds = 300;

    /**
     * 지난 날짜 TTL (초) - 하루가 지나면 변하지 않음
     */
    private int historicalTtlSeconds = 3600;

    /**
     * 거래쌍별 최신 시각 스냅샷 TTL (초)
     */
    private int snapshotTtlSeconds = 60;

    /**
     * 데이터 없음 캐시 TTL (초) - Penetration 방지
     */
    private int noDataTtlSeconds = 30;

    /**
     * 캐시 키 접두사
     */
    private String keyPrefix = "rates";
}
