package com.example.cryptorates.dto;

import com.example.cryptorates.domain.CryptoPair;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 수동 적재 응답 (거래쌍은 외부 표기로 노출)
 */
public record IngestionResponse(
        @JsonProperty("recorded_at") String recordedAt,
        List<String> succeeded,
        List<String> skipped,
        Map<String, String> failed,
        @JsonProperty("duration_ms") long durationMs
) {

    public static IngestionResponse from(IngestionSummary summary) {
        Map<String, String> failed = new LinkedHashMap<>();
        summary.failed().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> failed.put(entry.getKey().getSymbol(), entry.getValue()));
        return new IngestionResponse(
                summary.recordedAt().toString(),
                summary.succeeded().stream().map(CryptoPair::getSymbol).toList(),
                summary.skipped().stream().map(CryptoPair::getSymbol).toList(),
                failed,
                summary.durationMs()
        );
    }
}
