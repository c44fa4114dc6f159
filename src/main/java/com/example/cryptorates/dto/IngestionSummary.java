package com.example.cryptorates.dto;

import com.example.cryptorates.domain.CryptoPair;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 적재 실행 결과
 *
 * @param recordedAt 이번 실행에서 사용한 기록 시각
 * @param succeeded  새로 저장된 거래쌍
 * @param skipped    이미 같은 시각 시세가 있어 건너뛴 거래쌍
 * @param failed     실패한 거래쌍 → 사유
 */
public record IngestionSummary(
        Instant recordedAt,
        List<CryptoPair> succeeded,
        List<CryptoPair> skipped,
        Map<CryptoPair, String> failed,
        long durationMs
) {

    public IngestionSummary {
        succeeded = List.copyOf(succeeded);
        skipped = List.copyOf(skipped);
        failed = Map.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
