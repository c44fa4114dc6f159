package com.example.cryptorates.trigger;

import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.dto.IngestionRequest;

import java.time.Instant;
import java.util.Set;

/**
 * 비동기 적재 요청 메시지 (ApplicationEventPublisher 로 발행)
 */
public record FetchRatesMessage(Set<CryptoPair> pairs, boolean invalidateCache, Instant requestedAt) {

    public static FetchRatesMessage allPairs() {
        return new FetchRatesMessage(Set.of(), true, null);
    }

    public IngestionRequest toRequest() {
        return IngestionRequest.of(pairs, invalidateCache, requestedAt);
    }
}
