package com.example.cryptorates.dto;

import com.example.cryptorates.domain.CryptoPair;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * 시세 적재 요청 (타이머/수동 명령/비동기 메시지 공통)
 *
 * @param pairs           대상 거래쌍 (비어 있으면 전체)
 * @param invalidateCache 저장 성공 시 캐시 무효화 여부
 * @param requestedAt     기록 시각 (null 이면 실행 시점)
 */
public record IngestionRequest(Set<CryptoPair> pairs, boolean invalidateCache, Instant requestedAt) {

    public IngestionRequest {
        pairs = pairs == null || pairs.isEmpty()
                ? EnumSet.allOf(CryptoPair.class)
                : EnumSet.copyOf(pairs);
    }

    public static IngestionRequest allPairs() {
        return new IngestionRequest(null, true, null);
    }

    public static IngestionRequest of(Collection<CryptoPair> pairs, boolean invalidateCache, Instant requestedAt) {
        return new IngestionRequest(pairs == null || pairs.isEmpty() ? null : EnumSet.copyOf(pairs), invalidateCache, requestedAt);
    }
}
