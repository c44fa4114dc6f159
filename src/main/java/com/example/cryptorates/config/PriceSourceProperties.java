package com.example.cryptorates.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "price-source")
public class PriceSourceProperties {

    /**
     * 시세 제공처 API 주소
     */
    private String baseUrl = "https://api.binance.com/api/v3";

    /**
     * 연결 타임아웃 (밀리초)
     */
    private int connectTimeoutMs = 10_000;

    /**
     * 응답 타임아웃 (밀리초)
     */
    private int readTimeoutMs = 10_000;

    /**
     * 최대 시도 횟수 (전송 오류일 때만 재시도)
     */
    private int maxAttempts = 3;

    /**
     * 재시도 기본 대기 (밀리초) - 시도 횟수에 비례해 증가
     */
    private long retryDelayMs = 1_000;

    private String userAgent = "CryptoRates/1.0";
}
