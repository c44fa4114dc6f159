package com.example.cryptorates.dto;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * 거래쌍별 마지막 적재 시각 (헬스 체크용)
 * 데이터가 없는 거래쌍은 포함하지 않는다.
 *
 * @param latestRecordedAt 거래쌍 표기(EUR/BTC) → 마지막 recordedAt
 */
public record LatestSnapshot(Map<String, Instant> latestRecordedAt) {

    public LatestSnapshot {
        latestRecordedAt = latestRecordedAt == null ? Map.of() : new TreeMap<>(latestRecordedAt);
    }
}
