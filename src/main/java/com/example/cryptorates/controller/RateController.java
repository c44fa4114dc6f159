package com.example.cryptorates.controller;

import com.example.cryptorates.client.PriceSourceClient;
import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.dto.FetchRatesCommand;
import com.example.cryptorates.dto.HealthReport;
import com.example.cryptorates.dto.IngestionRequest;
import com.example.cryptorates.dto.IngestionResponse;
import com.example.cryptorates.dto.IngestionSummary;
import com.example.cryptorates.dto.RateQueryResult;
import com.example.cryptorates.service.HealthCheckService;
import com.example.cryptorates.service.RateIngestionService;
import com.example.cryptorates.service.RateQueryService;
import com.example.cryptorates.trigger.FetchRatesMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 시세 조회 / 적재 API
 */
@RestController
@RequestMapping("/api/rates")
@RequiredArgsConstructor
public class RateController {

    private final RateQueryService rateQueryService;
    private final RateIngestionService rateIngestionService;
    private final HealthCheckService healthCheckService;
    private final PriceSourceClient priceSourceClient;
    private final ApplicationEventPublisher eventPublisher;

    @GetMapping("/last-24h")
    public ResponseEntity<?> getLast24Hours(@RequestParam String pair) {
        return toResponse(rateQueryService.getRecentWindow(CryptoPair.fromSymbol(pair)));
    }

    @GetMapping("/day")
    public ResponseEntity<?> getDay(@RequestParam String pair, @RequestParam String date) {
        return toResponse(rateQueryService.getForPeriod(CryptoPair.fromSymbol(pair), date));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = healthCheckService.check();
        return ResponseEntity.status(report.status().getHttpStatus()).body(report);
    }

    /**
     * 수동 적재. 시세 제공처가 응답하지 않으면 실행하지 않는다.
     */
    @PostMapping("/fetch")
    public ResponseEntity<?> fetch(@RequestBody(required = false) FetchRatesCommand command) {
        IngestionRequest request = command == null ? IngestionRequest.allPairs() : command.toRequest();
        if (!priceSourceClient.isAvailable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiError.of("Price source unavailable", "Price source is not reachable, try again later"));
        }
        IngestionSummary summary = rateIngestionService.run(request);
        return ResponseEntity.ok(IngestionResponse.from(summary));
    }

    /**
     * 비동기 적재 요청. 접수만 하고 바로 응답한다.
     */
    @PostMapping("/fetch/async")
    public ResponseEntity<Void> fetchAsync(@RequestBody(required = false) FetchRatesCommand command) {
        IngestionRequest request = command == null ? IngestionRequest.allPairs() : command.toRequest();
        eventPublisher.publishEvent(
                new FetchRatesMessage(request.pairs(), request.invalidateCache(), request.requestedAt()));
        return ResponseEntity.accepted().build();
    }

    private ResponseEntity<?> toResponse(RateQueryResult result) {
        if (result.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiError.of("No data",
                            "No rates available for " + result.getPair().getSymbol()
                                    + " (" + result.getRequestedPeriod() + ")"));
        }
        return ResponseEntity.ok(result.getReport().orElseThrow());
    }
}
