package com.example.cryptorates.service;

import com.example.cryptorates.config.RateProperties;
import com.example.cryptorates.repository.RateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 보관 기간이 지난 시세 정리
 * 지난 날짜 캐시는 TTL 로 자연 만료되므로 따로 무효화하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateRetentionService {

    private final RateStore rateStore;
    private final RateProperties rateProperties;
    private final Clock clock;

    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(rateProperties.getRetentionDays()));
        try {
            return rateStore.deleteOlderThan(cutoff);
        } catch (RuntimeException e) {
            log.error("[보관 기간 정리 실패] cutoff={}, error={}", cutoff, e.getMessage(), e);
            throw new RateServiceException("Failed to purge rates older than " + cutoff, e);
        }
    }
}
