package com.example.cryptorates.client;

import com.example.cryptorates.config.PriceSourceProperties;
import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.metrics.RateMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binance 시세 클라이언트
 *
 * 재시도 정책 (priceSourceRetryTemplate):
 * 1. 전송 오류(연결 실패, 타임아웃)만 재시도, 대기 시간은 시도 횟수에 비례
 * 2. HTTP 4xx/5xx, JSON 파싱 실패는 즉시 실패
 * 3. 최대 시도 소진 시 RetryExhaustedException
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BinancePriceClient implements PriceSourceClient {

    static final String TICKER_ENDPOINT = "/ticker/price";
    static final String PING_ENDPOINT = "/ping";
    static final String ALL_PAIRS = "ALL_PAIRS";

    private final RestTemplate priceSourceRestTemplate;
    private final RetryTemplate priceSourceRetryTemplate;
    private final ObjectMapper objectMapper;
    private final PriceSourceProperties properties;
    private final RateMetrics rateMetrics;

    @Override
    public BigDecimal getCurrentPrice(CryptoPair pair) {
        String symbol = pair.getProviderSymbol();
        log.info("[시세 조회] pair={}, symbol={}", pair.getSymbol(), symbol);

        JsonNode body = request(TICKER_ENDPOINT, Map.of("symbol", symbol));

        JsonNode priceNode = body.path("price");
        if (priceNode.isMissingNode() || priceNode.isNull()) {
            throw new InvalidPriceResponseException(pair.getSymbol(), "Invalid response format: missing 'price' field");
        }
        BigDecimal price = parsePrice(priceNode)
                .orElseThrow(() -> new InvalidPriceResponseException(
                        pair.getSymbol(), "Invalid price received: " + priceNode.asText()));

        log.info("[시세 조회 성공] pair={}, price={}", pair.getSymbol(), price.toPlainString());
        return price;
    }

    @Override
    public Map<CryptoPair, BigDecimal> getAllCurrentPrices() {
        List<String> symbols = CryptoPair.supported().stream()
                .map(CryptoPair::getProviderSymbol)
                .toList();
        log.info("[전체 시세 조회] symbols={}", symbols);

        String symbolsParam = "[\"" + String.join("\",\"", symbols) + "\"]";
        JsonNode body = request(TICKER_ENDPOINT, Map.of("symbols", symbolsParam));

        if (!body.isArray()) {
            throw new InvalidPriceResponseException(ALL_PAIRS, "Invalid response format: expected array");
        }

        Map<CryptoPair, BigDecimal> prices = new EnumMap<>(CryptoPair.class);
        for (JsonNode item : body) {
            String symbol = item.path("symbol").asText(null);
            Optional<CryptoPair> pair = CryptoPair.findByProviderSymbol(symbol);
            if (pair.isEmpty()) {
                log.debug("[미지원 심볼 무시] symbol={}", symbol);
                continue;
            }
            Optional<BigDecimal> price = parsePrice(item.path("price"));
            if (price.isEmpty()) {
                log.warn("[잘못된 시세 항목 제외] symbol={}, item={}", symbol, item);
                continue;
            }
            prices.put(pair.get(), price.get());
        }

        if (prices.isEmpty()) {
            throw new InvalidPriceResponseException(ALL_PAIRS, "No valid prices received from price source");
        }

        log.info("[전체 시세 조회 성공] count={}, pairs={}", prices.size(), prices.keySet());
        return prices;
    }

    @Override
    public boolean isAvailable() {
        try {
            // 재시도 없이 한 번만
            exchange(PING_ENDPOINT, buildUri(PING_ENDPOINT, Map.of()), new HttpEntity<>(defaultHeaders()));
            return true;
        } catch (RuntimeException e) {
            log.warn("[가용성 확인 실패] error={}", e.getMessage());
            return false;
        }
    }

    private JsonNode request(String endpoint, Map<String, String> params) {
        URI uri = buildUri(endpoint, params);
        HttpEntity<Void> entity = new HttpEntity<>(defaultHeaders());
        AtomicInteger attempts = new AtomicInteger();
        Timer.Sample sample = rateMetrics.startTimer();
        String outcome = "error";

        try {
            JsonNode body = priceSourceRetryTemplate.execute(context -> {
                int attempt = attempts.incrementAndGet();
                try {
                    return exchange(endpoint, uri, entity);
                } catch (ResourceAccessException e) {
                    log.warn("[전송 오류] endpoint={}, attempt={}/{}, error={}",
                            endpoint, attempt, properties.getMaxAttempts(), e.getMessage());
                    throw e;
                }
            });
            log.debug("[요청 성공] endpoint={}, attempt={}", endpoint, attempts.get());
            outcome = "success";
            return body;

        } catch (ResourceAccessException e) {
            outcome = "retry_exhausted";
            throw new RetryExhaustedException(endpoint, attempts.get(),
                    new PriceSourceTransportException(endpoint, attempts.get(), e));

        } catch (BackOffInterruptedException e) {
            outcome = "interrupted";
            throw new RetryExhaustedException(endpoint, attempts.get(),
                    new PriceSourceTransportException(endpoint, attempts.get(), e));

        } finally {
            rateMetrics.stopPriceSourceRequest(sample, endpoint, outcome);
        }
    }

    // 한 번의 HTTP 호출. 전송 오류는 ResourceAccessException 그대로, 나머지는 재시도 불가 예외로 변환
    private JsonNode exchange(String endpoint, URI uri, HttpEntity<Void> entity) {
        try {
            ResponseEntity<String> response =
                    priceSourceRestTemplate.exchange(uri, HttpMethod.GET, entity, String.class);

            if (response.getStatusCode().value() != HttpStatus.OK.value()) {
                throw new PriceSourceProtocolException(endpoint, response.getStatusCode().value(), null);
            }
            return decode(endpoint, response.getBody());

        } catch (RestClientResponseException e) {
            throw new PriceSourceProtocolException(endpoint, e.getStatusCode().value(), e);
        }
    }

    private JsonNode decode(String endpoint, String body) {
        if (body == null || body.isBlank()) {
            throw new PriceSourceDecodingException(endpoint, new IllegalStateException("Empty response body"));
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PriceSourceDecodingException(endpoint, e);
        }
    }

    private Optional<BigDecimal> parsePrice(JsonNode priceNode) {
        if (priceNode == null || priceNode.isMissingNode() || priceNode.isNull()) {
            return Optional.empty();
        }
        try {
            BigDecimal price = new BigDecimal(priceNode.asText().trim());
            return price.signum() > 0 ? Optional.of(price) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private URI buildUri(String endpoint, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl()).path(endpoint);
        params.forEach(builder::queryParam);
        return builder.build().encode().toUri();
    }

    private HttpHeaders defaultHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, properties.getUserAgent());
        return headers;
    }
}
