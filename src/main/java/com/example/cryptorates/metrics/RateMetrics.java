package com.example.cryptorates.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 적재/조회/캐시 지표
 *
 * 이름과 태그는 여기서만 정의한다. 계측 대상 코드는 Timer.Sample 을 받아 끝에 넘겨주기만 한다.
 * HTTP 엔드포인트 지연은 actuator 의 http.server.requests 로 수집된다.
 */
@Component
@RequiredArgsConstructor
public class RateMetrics {

    static final String INGESTION_DURATION = "rates_ingestion_duration";
    static final String INGESTION_POINTS = "rates_ingestion_points_total";
    static final String CACHE_LOOKUPS = "rates_cache_lookups_total";
    static final String CACHE_ERRORS = "rates_cache_errors_total";
    static final String QUERY_LOAD_DURATION = "rates_query_load_duration";
    static final String PRICE_SOURCE_REQUEST_DURATION = "rates_price_source_request_duration";

    private final MeterRegistry meterRegistry;

    public enum CacheLookup {
        HIT, NO_DATA_HIT, MISS;

        String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * @return 적재 소요 시간 (나노초)
     */
    public long stopIngestion(Timer.Sample sample, boolean hasFailures) {
        return sample.stop(Timer.builder(INGESTION_DURATION)
                .description("Duration of one ingestion run")
                .tag("outcome", hasFailures ? "partial" : "success")
                .register(meterRegistry));
    }

    public void recordIngestedPoints(int saved, int skipped, int failed) {
        pointsCounter("saved").increment(saved);
        pointsCounter("skipped").increment(skipped);
        pointsCounter("failed").increment(failed);
    }

    public void recordCacheLookup(CacheLookup lookup) {
        Counter.builder(CACHE_LOOKUPS)
                .description("Rate cache lookups by result")
                .tag("result", lookup.tagValue())
                .register(meterRegistry)
                .increment();
    }

    /**
     * @param operation get, set, set_no_data, delete
     */
    public void recordCacheError(String operation) {
        Counter.builder(CACHE_ERRORS)
                .description("Cache backend errors treated as miss or ignored")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public void stopQueryLoad(Timer.Sample sample, String source) {
        sample.stop(Timer.builder(QUERY_LOAD_DURATION)
                .description("Store load latency on cache miss or uncached read")
                .tag("source", source)
                .register(meterRegistry));
    }

    public void stopPriceSourceRequest(Timer.Sample sample, String endpoint, String outcome) {
        sample.stop(Timer.builder(PRICE_SOURCE_REQUEST_DURATION)
                .description("Price source request latency including retries")
                .tag("endpoint", endpoint)
                .tag("outcome", outcome)
                .register(meterRegistry));
    }

    private Counter pointsCounter(String result) {
        return Counter.builder(INGESTION_POINTS)
                .description("Pairs processed by ingestion, by result")
                .tag("result", result)
                .register(meterRegistry);
    }
}
