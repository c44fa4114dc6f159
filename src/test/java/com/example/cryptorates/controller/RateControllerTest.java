package com.example.cryptorates.controller;

import com.example.cryptorates.client.PriceSourceClient;
import com.example.cryptorates.client.RetryExhaustedException;
import com.example.cryptorates.config.ApiProperties;
import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.domain.RatePoint;
import com.example.cryptorates.dto.HealthReport;
import com.example.cryptorates.dto.IngestionRequest;
import com.example.cryptorates.dto.IngestionSummary;
import com.example.cryptorates.dto.LatestSnapshot;
import com.example.cryptorates.dto.RateQueryResult;
import com.example.cryptorates.dto.RateReport;
import com.example.cryptorates.service.HealthCheckService;
import com.example.cryptorates.service.InvalidRateQueryException;
import com.example.cryptorates.service.RateIngestionService;
import com.example.cryptorates.service.RateQueryService;
import com.example.cryptorates.service.RateServiceException;
import com.example.cryptorates.trigger.FetchRatesMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RateController.class)
@RecordApplicationEvents
@DisplayName("RateController 테스트")
class RateControllerTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ApplicationEvents events;

    @MockBean
    private RateQueryService rateQueryService;

    @MockBean
    private RateIngestionService rateIngestionService;

    @MockBean
    private HealthCheckService healthCheckService;

    @MockBean
    private PriceSourceClient priceSourceClient;

    @MockBean
    private ApiProperties apiProperties;

    @Nested
    @DisplayName("1. 조회")
    class Queries {

        @Test
        @DisplayName("최근 24시간 응답 형식")
        void last24h() throws Exception {
            RatePoint point = RatePoint.builder()
                    .pair(CryptoPair.EUR_BTC)
                    .price(new BigDecimal("45000"))
                    .recordedAt(NOW)
                    .build();
            RateReport report = RateReport.of(CryptoPair.EUR_BTC, "last-24h", List.of(point), NOW, ZoneOffset.UTC);
            given(rateQueryService.getRecentWindow(CryptoPair.EUR_BTC))
                    .willReturn(RateQueryResult.found(CryptoPair.EUR_BTC, report));

            mockMvc.perform(get("/api/rates/last-24h").param("pair", "EUR/BTC"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.pair").value("EUR/BTC"))
                    .andExpect(jsonPath("$.requested_period").value("last-24h"))
                    .andExpect(jsonPath("$.count").value(1))
                    .andExpect(jsonPath("$.statistics.min_price").value("45000.00000000"))
                    .andExpect(jsonPath("$.statistics.price_change_percent").value("0.00"))
                    .andExpect(jsonPath("$.rates[0].timestamp").value(NOW.getEpochSecond()))
                    .andExpect(jsonPath("$.generated_at").value("2024-01-15T12:00:00Z"));
        }

        @Test
        @DisplayName("데이터가 없으면 404")
        void noData() throws Exception {
            given(rateQueryService.getForPeriod(CryptoPair.EUR_ETH, "2024-01-10"))
                    .willReturn(RateQueryResult.noData(CryptoPair.EUR_ETH, "day:2024-01-10"));

            mockMvc.perform(get("/api/rates/day").param("pair", "EUR/ETH").param("date", "2024-01-10"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("No data"));
        }

        @Test
        @DisplayName("지원하지 않는 거래쌍은 400")
        void unsupportedPair() throws Exception {
            mockMvc.perform(get("/api/rates/last-24h").param("pair", "USD/DOGE"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid pair"));
        }

        @Test
        @DisplayName("잘못된 날짜와 누락된 파라미터는 400")
        void validationFailures() throws Exception {
            given(rateQueryService.getForPeriod(eq(CryptoPair.EUR_BTC), eq("2099-01-01")))
                    .willThrow(new InvalidRateQueryException("date", "Date cannot be in the future: 2099-01-01"));

            mockMvc.perform(get("/api/rates/day").param("pair", "EUR/BTC").param("date", "2099-01-01"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Validation failed"));
            mockMvc.perform(get("/api/rates/day").param("pair", "EUR/BTC"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Missing required parameter: date"));
        }

        @Test
        @DisplayName("서비스 오류는 500, debug 가 아니면 내부 메시지를 숨긴다")
        void serviceErrorHidesDetails() throws Exception {
            given(rateQueryService.getRecentWindow(CryptoPair.EUR_BTC))
                    .willThrow(new RateServiceException("Failed", new IllegalStateException("jdbc:mysql://secret")));

            mockMvc.perform(get("/api/rates/last-24h").param("pair", "EUR/BTC"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error").value("Service error"))
                    .andExpect(jsonPath("$.details").doesNotExist());
        }

        @Test
        @DisplayName("debug 모드에서는 details 를 포함한다")
        void debugIncludesDetails() throws Exception {
            given(apiProperties.isDebug()).willReturn(true);
            given(rateQueryService.getRecentWindow(CryptoPair.EUR_BTC))
                    .willThrow(new RateServiceException("Failed", new IllegalStateException("db down")));

            mockMvc.perform(get("/api/rates/last-24h").param("pair", "EUR/BTC"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.details").value("Failed (cause: db down)"));
        }
    }

    @Nested
    @DisplayName("2. 헬스 체크")
    class Health {

        @Test
        @DisplayName("UNHEALTHY 는 503")
        void unhealthy() throws Exception {
            given(healthCheckService.check()).willReturn(HealthReport.unavailable("db down", NOW));

            mockMvc.perform(get("/api/rates/health"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.status").value("UNHEALTHY"));
        }

        @Test
        @DisplayName("DEGRADED 는 200")
        void degraded() throws Exception {
            given(healthCheckService.check()).willReturn(HealthReport.available(
                    new LatestSnapshot(Map.of("EUR/BTC", NOW)),
                    Map.of("EUR/BTC", true, "EUR/ETH", false, "EUR/LTC", true),
                    true, NOW));

            mockMvc.perform(get("/api/rates/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("DEGRADED"))
                    .andExpect(jsonPath("$.freshness['EUR/ETH']").value(false));
        }
    }

    @Nested
    @DisplayName("3. 적재 명령")
    class Fetch {

        @Test
        @DisplayName("제공처가 응답하면 적재 결과를 반환한다")
        void fetchRuns() throws Exception {
            given(priceSourceClient.isAvailable()).willReturn(true);
            given(rateIngestionService.run(any(IngestionRequest.class))).willReturn(new IngestionSummary(
                    NOW, List.of(CryptoPair.EUR_BTC), List.of(CryptoPair.EUR_ETH),
                    Map.of(CryptoPair.EUR_LTC, "Price not available for pair"), 12));

            mockMvc.perform(post("/api/rates/fetch")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"pairs\":[\"EUR/BTC\",\"EUR/ETH\",\"EUR/LTC\"]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.succeeded[0]").value("EUR/BTC"))
                    .andExpect(jsonPath("$.skipped[0]").value("EUR/ETH"))
                    .andExpect(jsonPath("$.failed['EUR/LTC']").value("Price not available for pair"));
        }

        @Test
        @DisplayName("제공처가 응답하지 않으면 실행하지 않고 503")
        void fetchSkippedWhenSourceDown() throws Exception {
            given(priceSourceClient.isAvailable()).willReturn(false);

            mockMvc.perform(post("/api/rates/fetch"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error").value("Price source unavailable"));
            verify(rateIngestionService, never()).run(any(IngestionRequest.class));
        }

        @Test
        @DisplayName("시세 제공처 오류는 502")
        void priceSourceErrorIsBadGateway() throws Exception {
            given(priceSourceClient.isAvailable()).willReturn(true);
            given(rateIngestionService.run(any(IngestionRequest.class)))
                    .willThrow(new RetryExhaustedException("/ticker/price", 3, null));

            mockMvc.perform(post("/api/rates/fetch"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.error").value("Price source error"));
        }

        @Test
        @DisplayName("비동기 적재는 메시지를 발행하고 202")
        void fetchAsyncPublishesMessage() throws Exception {
            mockMvc.perform(post("/api/rates/fetch/async")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"pairs\":[\"EUR/LTC\"],\"invalidate_cache\":false}"))
                    .andExpect(status().isAccepted());

            assertThat(events.stream(FetchRatesMessage.class))
                    .singleElement()
                    .satisfies(message -> {
                        assertThat(message.pairs()).containsExactly(CryptoPair.EUR_LTC);
                        assertThat(message.invalidateCache()).isFalse();
                    });
        }
    }
}
