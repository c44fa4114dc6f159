package com.example.cryptorates.trigger;

import com.example.cryptorates.service.RateIngestionService;
import com.example.cryptorates.service.RateRetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 주기 적재 / 보관 기간 정리 타이머
 * rates.scheduler.enabled=false 면 등록되지 않는다 (테스트).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "rates.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class RateFetchScheduler {

    private final RateIngestionService rateIngestionService;
    private final RateRetentionService rateRetentionService;

    @Scheduled(fixedDelayString = "${rates.scheduler.fetch-interval:PT5M}",
            initialDelayString = "${rates.scheduler.initial-delay:PT10S}")
    public void fetchRates() {
        try {
            rateIngestionService.run();
        } catch (RuntimeException e) {
            log.error("[주기 적재 실패] error={}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${rates.scheduler.retention-cron:0 30 3 * * *}")
    public void purgeExpiredRates() {
        try {
            rateRetentionService.purgeExpired();
        } catch (RuntimeException e) {
            log.error("[보관 기간 정리 실패] error={}", e.getMessage());
        }
    }
}
