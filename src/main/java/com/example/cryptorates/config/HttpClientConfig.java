package com.example.cryptorates.config;

import com.example.cryptorates.client.LinearBackOffPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Configuration
public class HttpClientConfig {

    /**
     * 시세 제공처 전용 RestTemplate (연결/응답 타임아웃 필수)
     */
    @Bean
    public RestTemplate priceSourceRestTemplate(PriceSourceProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getConnectTimeoutMs());
        factory.setReadTimeout(properties.getReadTimeoutMs());
        return new RestTemplate(factory);
    }

    /**
     * 전송 오류(ResourceAccessException)만 재시도. HTTP 상태 오류, 파싱 실패는 즉시 실패.
     */
    @Bean
    public RetryTemplate priceSourceRetryTemplate(PriceSourceProperties properties) {
        return transportRetryTemplate(properties.getMaxAttempts(), properties.getRetryDelayMs());
    }

    public static RetryTemplate transportRetryTemplate(int maxAttempts, long retryDelayMs) {
        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(
                new SimpleRetryPolicy(maxAttempts, Map.of(ResourceAccessException.class, true)));
        retryTemplate.setBackOffPolicy(new LinearBackOffPolicy(retryDelayMs));
        return retryTemplate;
    }
}
