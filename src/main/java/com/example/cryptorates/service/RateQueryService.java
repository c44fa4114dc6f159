package com.example.cryptorates.service;

import com.example.cryptorates.cache.CacheKeys;
import com.example.cryptorates.cache.CacheTier;
import com.example.cryptorates.cache.RateCache;
import com.example.cryptorates.cache.RateCache.CachedValue;
import com.example.cryptorates.config.RateProperties;
import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.domain.PeriodStatistics;
import com.example.cryptorates.domain.RatePoint;
import com.example.cryptorates.dto.LatestSnapshot;
import com.example.cryptorates.dto.RateQueryResult;
import com.example.cryptorates.dto.RateReport;
import com.example.cryptorates.metrics.RateMetrics;
import com.example.cryptorates.metrics.RateMetrics.CacheLookup;
import com.example.cryptorates.repository.RateStore;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 시세 조회 서비스 (Cache-Aside)
 *
 * 1. 캐시 조회 → 히트면 그대로 반환 (데이터 없음 캐시 포함)
 * 2. 미스면 저장소 조회 → 통계 계산 → TTL 등급에 맞춰 캐시 저장
 * 같은 키에 동시에 미스가 나면 각 요청이 저장소를 따로 조회한다 (SingleFlight 없음).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateQueryService {

    static final String PERIOD_LAST_24H = "last-24h";
    static final String PERIOD_DAY = "day:";

    private final RateStore rateStore;
    private final RateCache rateCache;
    private final RateCacheService rateCacheService;
    private final CacheKeys cacheKeys;
    private final RateProperties rateProperties;
    private final Clock clock;
    private final RateMetrics rateMetrics;

    public RateQueryResult getRecentWindow(CryptoPair pair) {
        return getRecentWindow(pair, rateProperties.getRecentWindow());
    }

    /**
     * 최근 window 구간 시세. 기본 구간(24시간)만 캐싱한다.
     */
    public RateQueryResult getRecentWindow(CryptoPair pair, Duration window) {
        if (window.isNegative() || window.isZero()) {
            throw new InvalidRateQueryException("window", "Window duration must be positive");
        }
        String period = recentPeriod(window);
        log.info("[최근 시세 조회] pair={}, period={}", pair.getSymbol(), period);

        try {
            Supplier<List<RatePoint>> loader = () -> {
                Instant now = clock.instant();
                return rateStore.findRange(pair, now.minus(window), now);
            };
            if (!window.equals(rateProperties.getRecentWindow())) {
                Timer.Sample sample = rateMetrics.startTimer();
                try {
                    return load(pair, period, loader);
                } finally {
                    rateMetrics.stopQueryLoad(sample, "uncached");
                }
            }
            return cacheAside(pair, period, cacheKeys.recent(pair), CacheTier.RECENT, loader);
        } catch (RuntimeException e) {
            log.error("[최근 시세 조회 실패] pair={}, error={}", pair.getSymbol(), e.getMessage(), e);
            throw new RateServiceException("Failed to fetch " + period + " rates for " + pair.getSymbol(), e);
        }
    }

    /**
     * @param date ISO 날짜 (yyyy-MM-dd)
     * @throws InvalidRateQueryException 형식 오류 또는 미래 날짜
     */
    public RateQueryResult getForPeriod(CryptoPair pair, String date) {
        if (date == null || date.isBlank()) {
            throw new InvalidRateQueryException("date", "Date parameter is required for daily rates");
        }
        LocalDate parsed;
        try {
            parsed = LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRateQueryException("date", "Invalid date format, expected YYYY-MM-DD: " + date);
        }
        return getForPeriod(pair, parsed);
    }

    /**
     * 기준 시간대의 [00:00, 23:59:59.999999] 구간 시세
     */
    public RateQueryResult getForPeriod(CryptoPair pair, LocalDate date) {
        LocalDate today = rateCacheService.today();
        if (date.isAfter(today)) {
            throw new InvalidRateQueryException("date", "Date cannot be in the future: " + date);
        }
        String period = PERIOD_DAY + date;
        log.info("[일별 시세 조회] pair={}, date={}", pair.getSymbol(), date);

        ZoneId zone = rateProperties.getZone();
        Instant start = startOfDay(date, zone);
        Instant end = endOfDay(date, zone);
        try {
            return cacheAside(pair, period, cacheKeys.day(pair, date), CacheTier.forDay(date, today),
                    () -> rateStore.findRange(pair, start, end));
        } catch (RuntimeException e) {
            log.error("[일별 시세 조회 실패] pair={}, date={}, error={}", pair.getSymbol(), date, e.getMessage(), e);
            throw new RateServiceException("Failed to fetch daily rates for " + pair.getSymbol() + " on " + date, e);
        }
    }

    /**
     * 거래쌍별 마지막 적재 시각. 데이터가 없는 거래쌍은 빠진다.
     */
    public LatestSnapshot getLatestSnapshot(Collection<CryptoPair> pairs) {
        Set<CryptoPair> requested = pairs == null || pairs.isEmpty()
                ? EnumSet.allOf(CryptoPair.class)
                : EnumSet.copyOf(pairs);
        String key = cacheKeys.snapshot(requested);

        try {
            Optional<CachedValue<LatestSnapshot>> cached = rateCache.get(key, LatestSnapshot.class);
            if (cached.isPresent() && !cached.get().isNoData()) {
                rateMetrics.recordCacheLookup(CacheLookup.HIT);
                return cached.get().value();
            }
            rateMetrics.recordCacheLookup(CacheLookup.MISS);

            Map<String, Instant> latest = new LinkedHashMap<>();
            for (CryptoPair pair : requested) {
                rateStore.findLatest(pair)
                        .ifPresent(point -> latest.put(pair.getSymbol(), point.getRecordedAt()));
            }
            LatestSnapshot snapshot = new LatestSnapshot(latest);
            rateCache.set(key, snapshot, rateCacheService.ttl(CacheTier.SNAPSHOT));
            return snapshot;
        } catch (RuntimeException e) {
            log.error("[최신 시각 조회 실패] pairs={}, error={}", requested, e.getMessage(), e);
            throw new RateServiceException("Failed to fetch latest rates", e);
        }
    }

    /**
     * 마지막 시세가 freshness 기준 시간 안에 있는지
     */
    public boolean hasRecentData(CryptoPair pair) {
        try {
            Instant threshold = clock.instant().minus(rateProperties.getFreshnessThreshold());
            return rateStore.findLatest(pair)
                    .map(point -> point.getRecordedAt().isAfter(threshold))
                    .orElse(false);
        } catch (RuntimeException e) {
            log.error("[최신 데이터 확인 실패] pair={}, error={}", pair.getSymbol(), e.getMessage());
            return false;
        }
    }

    /**
     * DB 집계 통계 (캐시하지 않음)
     */
    public PeriodStatistics getStatistics(CryptoPair pair, Instant start, Instant end) {
        if (start.isAfter(end)) {
            throw new InvalidRateQueryException("start", "Start must not be after end");
        }
        try {
            return rateStore.computeStatistics(pair, start, end);
        } catch (RuntimeException e) {
            log.error("[통계 조회 실패] pair={}, error={}", pair.getSymbol(), e.getMessage(), e);
            throw new RateServiceException("Failed to fetch statistics for " + pair.getSymbol(), e);
        }
    }

    private RateQueryResult cacheAside(CryptoPair pair,
                                       String period,
                                       String key,
                                       CacheTier tier,
                                       Supplier<List<RatePoint>> loader) {
        Optional<CachedValue<RateReport>> cached = rateCache.get(key, RateReport.class);
        if (cached.isPresent()) {
            CachedValue<RateReport> value = cached.get();
            if (value.isNoData()) {
                rateMetrics.recordCacheLookup(CacheLookup.NO_DATA_HIT);
                return RateQueryResult.noData(pair, period);
            }
            rateMetrics.recordCacheLookup(CacheLookup.HIT);
            return RateQueryResult.found(pair, value.value());
        }
        rateMetrics.recordCacheLookup(CacheLookup.MISS);

        Timer.Sample sample = rateMetrics.startTimer();
        RateQueryResult result;
        try {
            result = load(pair, period, loader);
        } finally {
            rateMetrics.stopQueryLoad(sample, tier.name().toLowerCase(Locale.ROOT));
        }
        if (result.isEmpty()) {
            rateCache.setNoData(key, rateCacheService.ttl(CacheTier.NO_DATA));
        } else {
            rateCache.set(key, result.getReport().orElseThrow(), rateCacheService.ttl(tier));
        }
        log.info("[캐시 미스 → 원천 조회] key={}, tier={}, empty={}", key, tier, result.isEmpty());
        return result;
    }

    private RateQueryResult load(CryptoPair pair, String period, Supplier<List<RatePoint>> loader) {
        List<RatePoint> points = loader.get();
        if (points.isEmpty()) {
            log.warn("[데이터 없음] pair={}, period={}", pair.getSymbol(), period);
            return RateQueryResult.noData(pair, period);
        }
        RateReport report = RateReport.of(pair, period, points, clock.instant(), rateProperties.getZone());
        return RateQueryResult.found(pair, report);
    }

    static Instant startOfDay(LocalDate date, ZoneId zone) {
        return date.atStartOfDay(zone).toInstant();
    }

    static Instant endOfDay(LocalDate date, ZoneId zone) {
        return date.plusDays(1).atStartOfDay(zone).toInstant().minus(1, ChronoUnit.MICROS);
    }

    static String recentPeriod(Duration window) {
        if (window.equals(Duration.ofHours(24))) {
            return PERIOD_LAST_24H;
        }
        if (window.toMinutes() % 60 == 0) {
            return "last-" + window.toHours() + "h";
        }
        return "last-" + window.toMinutes() + "m";
    }
}
