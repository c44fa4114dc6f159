package com.example.cryptorates.service;

import com.example.cryptorates.client.PriceSourceClient;
import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.dto.HealthReport;
import com.example.cryptorates.dto.LatestSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 헬스 체크
 * HEALTHY: 모든 거래쌍 fresh + 시세 제공처 응답
 * DEGRADED: 일부 거래쌍 stale 또는 제공처 불가
 * UNHEALTHY: 저장소 조회 불가
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private final RateQueryService rateQueryService;
    private final PriceSourceClient priceSourceClient;
    private final Clock clock;

    public HealthReport check() {
        Instant checkedAt = clock.instant();
        try {
            LatestSnapshot snapshot = rateQueryService.getLatestSnapshot(CryptoPair.supported());

            Map<String, Boolean> freshness = new LinkedHashMap<>();
            for (CryptoPair pair : CryptoPair.supported()) {
                freshness.put(pair.getSymbol(), rateQueryService.hasRecentData(pair));
            }
            boolean available = priceSourceClient.isAvailable();

            HealthReport report = HealthReport.available(snapshot, freshness, available, checkedAt);
            if (!report.isHealthy()) {
                log.warn("[헬스 체크] status={}, freshness={}, priceSourceAvailable={}",
                        report.status(), freshness, available);
            }
            return report;
        } catch (RateServiceException e) {
            log.error("[헬스 체크 실패] error={}", e.getMessage());
            return HealthReport.unavailable(e.getMessage(), checkedAt);
        }
    }
}
