package com.example.cryptorates.service;

import com.example.cryptorates.client.PriceSourceClient;
import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.domain.RatePoint;
import com.example.cryptorates.dto.IngestionRequest;
import com.example.cryptorates.dto.IngestionSummary;
import com.example.cryptorates.metrics.RateMetrics;
import com.example.cryptorates.repository.RateStore;
import com.example.cryptorates.repository.RateStore.SaveResult;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 시세 적재 실행기
 *
 * 타이머, 수동 명령, 비동기 메시지가 모두 run() 하나로 들어온다.
 * 1. 거래쌍별로 같은 시각 시세가 있으면 건너뜀
 * 2. 남은 거래쌍은 일괄 조회 한 번으로 가격을 받음
 * 3. 거래쌍별 저장 → 저장 성공 시 캐시 무효화
 * 한 거래쌍의 실패는 기록만 하고 나머지 거래쌍은 계속 진행한다 (이미 저장된 건 롤백 없음).
 * 동시에 여러 실행이 겹쳐도 별도 잠금 없이 저장소 유니크 제약으로 중복이 걸러진다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateIngestionService {

    static final String PRICE_NOT_AVAILABLE = "Price not available for pair";

    private final PriceSourceClient priceSourceClient;
    private final RateStore rateStore;
    private final RateCacheService rateCacheService;
    private final Clock clock;
    private final RateMetrics rateMetrics;

    public IngestionSummary run() {
        return run(IngestionRequest.allPairs());
    }

    public IngestionSummary run(IngestionRequest request) {
        Timer.Sample sample = rateMetrics.startTimer();
        Instant recordedAt = (request.requestedAt() != null ? request.requestedAt() : clock.instant())
                .truncatedTo(ChronoUnit.SECONDS);
        log.info("[시세 적재 시작] pairs={}, recordedAt={}", request.pairs(), recordedAt);

        List<CryptoPair> succeeded = new ArrayList<>();
        List<CryptoPair> skipped = new ArrayList<>();
        Map<CryptoPair, String> failed = new EnumMap<>(CryptoPair.class);

        List<CryptoPair> pending = new ArrayList<>();
        for (CryptoPair pair : request.pairs()) {
            try {
                if (rateStore.existsForPairAndTime(pair, recordedAt)) {
                    log.info("[이미 적재됨] pair={}, recordedAt={}", pair.getSymbol(), recordedAt);
                    skipped.add(pair);
                } else {
                    pending.add(pair);
                }
            } catch (RuntimeException e) {
                log.error("[중복 확인 실패] pair={}, error={}", pair.getSymbol(), e.getMessage());
                failed.put(pair, reason(e));
            }
        }

        if (!pending.isEmpty()) {
            Map<CryptoPair, BigDecimal> prices = fetchPrices(pending, failed);
            if (prices != null) {
                for (CryptoPair pair : pending) {
                    ingest(pair, prices.get(pair), recordedAt, request.invalidateCache(),
                            succeeded, skipped, failed);
                }
            }
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(rateMetrics.stopIngestion(sample, !failed.isEmpty()));
        rateMetrics.recordIngestedPoints(succeeded.size(), skipped.size(), failed.size());
        IngestionSummary summary = new IngestionSummary(recordedAt, succeeded, skipped, failed, durationMs);
        if (summary.hasFailures()) {
            log.warn("[시세 적재 완료 - 일부 실패] succeeded={}, skipped={}, failed={}, durationMs={}",
                    succeeded, skipped, failed, durationMs);
        } else {
            log.info("[시세 적재 완료] succeeded={}, skipped={}, durationMs={}", succeeded, skipped, durationMs);
        }
        return summary;
    }

    // 일괄 조회 실패 시 대기 중인 거래쌍 전부를 같은 사유로 실패 처리하고 null 반환
    private Map<CryptoPair, BigDecimal> fetchPrices(List<CryptoPair> pending, Map<CryptoPair, String> failed) {
        try {
            return priceSourceClient.getAllCurrentPrices();
        } catch (RuntimeException e) {
            log.error("[일괄 시세 조회 실패] pairs={}, error={}", pending, e.getMessage());
            String reason = reason(e);
            pending.forEach(pair -> failed.put(pair, reason));
            return null;
        }
    }

    private void ingest(CryptoPair pair,
                        BigDecimal price,
                        Instant recordedAt,
                        boolean invalidateCache,
                        List<CryptoPair> succeeded,
                        List<CryptoPair> skipped,
                        Map<CryptoPair, String> failed) {
        if (price == null) {
            log.warn("[시세 누락] pair={}", pair.getSymbol());
            failed.put(pair, PRICE_NOT_AVAILABLE);
            return;
        }
        try {
            RatePoint point = RatePoint.builder()
                    .pair(pair)
                    .price(price.setScale(RatePoint.PRICE_SCALE, RoundingMode.HALF_UP))
                    .recordedAt(recordedAt)
                    .createdAt(clock.instant())
                    .build();

            if (rateStore.save(point) == SaveResult.SKIPPED) {
                skipped.add(pair);
                return;
            }
            succeeded.add(pair);
            log.info("[시세 저장] pair={}, price={}, recordedAt={}",
                    pair.getSymbol(), point.getPrice().toPlainString(), recordedAt);

            if (invalidateCache) {
                rateCacheService.invalidate(pair);
            }
        } catch (RuntimeException e) {
            log.error("[시세 저장 실패] pair={}, error={}", pair.getSymbol(), e.getMessage(), e);
            failed.put(pair, reason(e));
        }
    }

    private static String reason(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
