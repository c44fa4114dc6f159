package com.example.cryptorates.service;

import com.example.cryptorates.client.PriceSourceClient;
import com.example.cryptorates.client.RetryExhaustedException;
import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.domain.RatePoint;
import com.example.cryptorates.dto.IngestionRequest;
import com.example.cryptorates.dto.IngestionSummary;
import com.example.cryptorates.metrics.RateMetrics;
import com.example.cryptorates.repository.RateStore;
import com.example.cryptorates.repository.RateStore.SaveResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("RateIngestionService 테스트")
class RateIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00.789Z");
    private static final Instant RECORDED_AT = Instant.parse("2024-01-15T12:00:00Z");

    @Mock
    private PriceSourceClient priceSourceClient;

    @Mock
    private RateStore rateStore;

    @Mock
    private RateCacheService rateCacheService;

    private SimpleMeterRegistry meterRegistry;
    private RateIngestionService rateIngestionService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        rateIngestionService = new RateIngestionService(priceSourceClient, rateStore, rateCacheService,
                Clock.fixed(NOW, ZoneOffset.UTC), new RateMetrics(meterRegistry));
    }

    @Test
    @DisplayName("전체 거래쌍을 일괄 조회 한 번으로 저장하고 캐시를 무효화한다")
    void savesAllPairsWithSingleBatchFetch() {
        // given
        given(priceSourceClient.getAllCurrentPrices()).willReturn(Map.of(
                CryptoPair.EUR_BTC, new BigDecimal("45000.1"),
                CryptoPair.EUR_ETH, new BigDecimal("2500"),
                CryptoPair.EUR_LTC, new BigDecimal("70.123456789")
        ));
        given(rateStore.save(any())).willReturn(SaveResult.SAVED);

        // when
        IngestionSummary summary = rateIngestionService.run();

        // then
        assertThat(summary.succeeded()).containsExactly(CryptoPair.EUR_BTC, CryptoPair.EUR_ETH, CryptoPair.EUR_LTC);
        assertThat(summary.hasFailures()).isFalse();
        assertThat(summary.recordedAt()).isEqualTo(RECORDED_AT);
        verify(priceSourceClient, times(1)).getAllCurrentPrices();
        verify(priceSourceClient, never()).getCurrentPrice(any(CryptoPair.class));
        verify(rateCacheService, times(3)).invalidate(any());

        ArgumentCaptor<RatePoint> saved = ArgumentCaptor.forClass(RatePoint.class);
        verify(rateStore, times(3)).save(saved.capture());
        assertThat(saved.getAllValues()).allSatisfy(point -> {
            assertThat(point.getRecordedAt()).isEqualTo(RECORDED_AT);
            assertThat(point.getCreatedAt()).isEqualTo(NOW);
            assertThat(point.getPrice().scale()).isEqualTo(RatePoint.PRICE_SCALE);
        });
        assertThat(saved.getAllValues().get(2).getPrice().toPlainString()).isEqualTo("70.12345679");
    }

    @Test
    @DisplayName("이미 같은 시각 시세가 있는 거래쌍은 조회 없이 건너뛴다")
    void skipsExistingPairs() {
        given(rateStore.existsForPairAndTime(CryptoPair.EUR_BTC, RECORDED_AT)).willReturn(true);

        IngestionSummary summary = rateIngestionService.run(
                IngestionRequest.of(List.of(CryptoPair.EUR_BTC), true, null));

        assertThat(summary.skipped()).containsExactly(CryptoPair.EUR_BTC);
        assertThat(summary.succeeded()).isEmpty();
        verify(priceSourceClient, never()).getAllCurrentPrices();
        verify(rateStore, never()).save(any());
    }

    @Test
    @DisplayName("저장 경합에서 진 거래쌍은 SKIPPED 로 기록하고 캐시를 건드리지 않는다")
    void lostInsertRaceIsSkipped() {
        given(priceSourceClient.getAllCurrentPrices()).willReturn(Map.of(CryptoPair.EUR_BTC, BigDecimal.TEN));
        given(rateStore.save(any())).willReturn(SaveResult.SKIPPED);

        IngestionSummary summary = rateIngestionService.run(
                IngestionRequest.of(List.of(CryptoPair.EUR_BTC), true, null));

        assertThat(summary.skipped()).containsExactly(CryptoPair.EUR_BTC);
        verify(rateCacheService, never()).invalidate(any());
    }

    @Test
    @DisplayName("한 거래쌍 저장 실패가 나머지 거래쌍을 막지 않는다")
    void isolatesPerPairFailures() {
        // given - ETH 는 응답에서 빠지고 LTC 는 저장 실패
        given(priceSourceClient.getAllCurrentPrices()).willReturn(Map.of(
                CryptoPair.EUR_BTC, new BigDecimal("45000"),
                CryptoPair.EUR_LTC, new BigDecimal("70")
        ));
        given(rateStore.save(argThat(point -> point != null && point.getPair() == CryptoPair.EUR_BTC)))
                .willReturn(SaveResult.SAVED);
        given(rateStore.save(argThat(point -> point != null && point.getPair() == CryptoPair.EUR_LTC)))
                .willThrow(new IllegalStateException("disk full"));

        // when
        IngestionSummary summary = rateIngestionService.run();

        // then
        assertThat(summary.succeeded()).containsExactly(CryptoPair.EUR_BTC);
        assertThat(summary.failed())
                .containsEntry(CryptoPair.EUR_ETH, RateIngestionService.PRICE_NOT_AVAILABLE)
                .containsEntry(CryptoPair.EUR_LTC, "disk full");
        verify(rateCacheService).invalidate(CryptoPair.EUR_BTC);
    }

    @Test
    @DisplayName("실행 시간과 결과별 거래쌍 수를 지표로 남긴다")
    void recordsIngestionMetrics() {
        // given - BTC 저장, ETH 누락
        given(priceSourceClient.getAllCurrentPrices()).willReturn(Map.of(CryptoPair.EUR_BTC, BigDecimal.TEN));
        given(rateStore.save(any())).willReturn(SaveResult.SAVED);

        // when
        rateIngestionService.run(IngestionRequest.of(List.of(CryptoPair.EUR_BTC, CryptoPair.EUR_ETH), true, null));

        // then
        assertThat(meterRegistry.get("rates_ingestion_duration").tag("outcome", "partial").timer().count())
                .isEqualTo(1);
        assertThat(meterRegistry.get("rates_ingestion_points_total").tag("result", "saved").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("rates_ingestion_points_total").tag("result", "failed").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("rates_ingestion_points_total").tag("result", "skipped").counter().count())
                .isZero();
    }

    @Test
    @DisplayName("일괄 조회 실패 시 대기 중인 거래쌍 모두 같은 사유로 실패")
    void batchFetchFailureFailsPendingPairs() {
        given(rateStore.existsForPairAndTime(any(), any())).willReturn(false);
        given(rateStore.existsForPairAndTime(CryptoPair.EUR_BTC, RECORDED_AT)).willReturn(true);
        given(priceSourceClient.getAllCurrentPrices())
                .willThrow(new RetryExhaustedException("/ticker/price", 3, null));

        IngestionSummary summary = rateIngestionService.run();

        assertThat(summary.skipped()).containsExactly(CryptoPair.EUR_BTC);
        assertThat(summary.failed()).containsOnlyKeys(CryptoPair.EUR_ETH, CryptoPair.EUR_LTC);
        assertThat(summary.failed().get(CryptoPair.EUR_ETH)).contains("failed after 3 attempts");
        verify(rateStore, never()).save(any());
    }

    @Test
    @DisplayName("invalidateCache=false 면 캐시를 무효화하지 않고 요청 시각을 초 단위로 사용한다")
    void respectsRequestOptions() {
        Instant requestedAt = Instant.parse("2024-01-15T08:30:15.500Z");
        given(priceSourceClient.getAllCurrentPrices()).willReturn(Map.of(CryptoPair.EUR_ETH, BigDecimal.ONE));
        given(rateStore.save(any())).willReturn(SaveResult.SAVED);

        IngestionSummary summary = rateIngestionService.run(
                IngestionRequest.of(List.of(CryptoPair.EUR_ETH), false, requestedAt));

        assertThat(summary.recordedAt()).isEqualTo(Instant.parse("2024-01-15T08:30:15Z"));
        assertThat(summary.succeeded()).containsExactly(CryptoPair.EUR_ETH);
        verify(rateCacheService, never()).invalidate(any());
    }
}
