package com.example.cryptorates.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 헬스 체크 결과
 * freshness 는 거래쌍 표기(EUR/BTC) → fresh 여부.
 * UNHEALTHY 일 때만 error 가 채워지고 나머지 payload 는 비어 있다.
 */
public record HealthReport(
        Status status,
        Instant checkedAt,
        LatestSnapshot latestRates,
        Map<String, Boolean> freshness,
        boolean priceSourceAvailable,
        String error
) {

    public enum Status {
        HEALTHY(200),
        DEGRADED(200),
        UNHEALTHY(503);

        private final int httpStatus;

        Status(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int getHttpStatus() {
            return httpStatus;
        }
    }

    public static HealthReport available(LatestSnapshot latestRates,
                                         Map<String, Boolean> freshness,
                                         boolean priceSourceAvailable,
                                         Instant checkedAt) {
        boolean allFresh = freshness.values().stream().allMatch(Boolean::booleanValue);
        Status status = allFresh && priceSourceAvailable ? Status.HEALTHY : Status.DEGRADED;
        return new HealthReport(status, checkedAt, latestRates, Collections.unmodifiableMap(new TreeMap<>(freshness)),
                priceSourceAvailable, null);
    }

    public static HealthReport unavailable(String error, Instant checkedAt) {
        return new HealthReport(Status.UNHEALTHY, checkedAt, new LatestSnapshot(Map.of()), Map.of(), false, error);
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
