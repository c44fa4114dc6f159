package com.example.cryptorates.trigger;

import com.example.cryptorates.dto.IngestionSummary;
import com.example.cryptorates.service.RateIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FetchRatesMessageHandler {

    private final RateIngestionService rateIngestionService;

    @Async
    @EventListener
    public void handle(FetchRatesMessage message) {
        log.info("[적재 메시지 수신] pairs={}", message.pairs());
        try {
            IngestionSummary summary = rateIngestionService.run(message.toRequest());
            log.info("[적재 메시지 처리] succeeded={}, failed={}", summary.succeeded(), summary.failed().keySet());
        } catch (RuntimeException e) {
            log.error("[적재 메시지 처리 실패] error={}", e.getMessage(), e);
        }
    }
}
