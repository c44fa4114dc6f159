package com.example.cryptorates.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;

@Data
@Configuration
@ConfigurationProperties(prefix = "rates")
public class RateProperties {

    /**
     * 일 단위 조회 기준 시간대
     */
    private ZoneId zone = ZoneId.of("UTC");

    /**
     * 최근 구간 기본 길이
     */
    private Duration recentWindow = Duration.ofHours(24);

    /**
     * 이 시간 안에 적재된 시세가 있으면 fresh
     */
    private Duration freshnessThreshold = Duration.ofMinutes(10);

    /**
     * 보관 기간 (일)
     */
    private int retentionDays = 365;

    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Scheduler {

        private boolean enabled = true;

        /**
         * 적재 주기
         */
        private Duration fetchInterval = Duration.ofMinutes(5);

        /**
         * 보관 기간 정리 cron
         */
        private String retentionCron = "0 30 3 * * *";
    }
}
