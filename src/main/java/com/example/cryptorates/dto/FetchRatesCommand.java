package com.example.cryptorates.dto;

import com.example.cryptorates.domain.CryptoPair;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * 수동 적재 요청 본문. 모든 필드 생략 가능.
 *
 * @param pairs 거래쌍 표기 목록 (EUR/BTC), 비어 있으면 전체
 */
public record FetchRatesCommand(
        List<String> pairs,
        @JsonProperty("invalidate_cache") Boolean invalidateCache,
        @JsonProperty("requested_at") Instant requestedAt
) {

    /**
     * @throws com.example.cryptorates.client.UnsupportedPairException 지원하지 않는 거래쌍
     */
    public IngestionRequest toRequest() {
        List<CryptoPair> resolved = pairs == null
                ? List.of()
                : pairs.stream().map(CryptoPair::fromSymbol).toList();
        return IngestionRequest.of(resolved, invalidateCache == null || invalidateCache, requestedAt);
    }
}
