package com.example.cryptorates.dto;

import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.domain.RatePoint;
import com.example.cryptorates.domain.RateStatistics;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;

/**
 * 구간 시세 조회 응답 (캐시에 JSON 으로 그대로 저장됨)
 */
public record RateReport(
        String pair,
        @JsonProperty("requested_period") String requestedPeriod,
        StatisticsView statistics,
        List<RateItem> rates,
        @JsonProperty("generated_at") String generatedAt,
        int count
) {

    private static final int PRICE_SCALE = RatePoint.PRICE_SCALE;
    private static final int PERCENT_SCALE = 2;

    public static RateReport of(CryptoPair pair,
                                String requestedPeriod,
                                List<RatePoint> points,
                                Instant generatedAt,
                                ZoneId zone) {
        RateStatistics statistics = RateStatistics.from(points);
        List<RateItem> items = points.stream()
                .sorted(Comparator.comparing(RatePoint::getRecordedAt))
                .map(point -> RateItem.from(point, zone))
                .toList();
        return new RateReport(
                pair.getSymbol(),
                requestedPeriod,
                StatisticsView.from(statistics),
                items,
                formatTimestamp(generatedAt, zone),
                items.size()
        );
    }

    static String formatTimestamp(Instant instant, ZoneId zone) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atZone(zone));
    }

    static String formatPrice(BigDecimal value) {
        return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    public record StatisticsView(
            @JsonProperty("min_price") String minPrice,
            @JsonProperty("max_price") String maxPrice,
            @JsonProperty("avg_price") String avgPrice,
            @JsonProperty("price_change") String priceChange,
            @JsonProperty("price_change_percent") String priceChangePercent,
            @JsonProperty("total_records") int totalRecords
    ) {

        public static StatisticsView from(RateStatistics statistics) {
            return new StatisticsView(
                    formatPrice(statistics.minPrice()),
                    formatPrice(statistics.maxPrice()),
                    formatPrice(statistics.avgPrice()),
                    formatPrice(statistics.priceChange()),
                    statistics.priceChangePercent().setScale(PERCENT_SCALE, RoundingMode.HALF_UP).toPlainString(),
                    statistics.totalRecords()
            );
        }
    }

    public record RateItem(
            String price,
            @JsonProperty("recorded_at") String recordedAt,
            long timestamp
    ) {

        public static RateItem from(RatePoint point, ZoneId zone) {
            return new RateItem(
                    formatPrice(point.getPrice()),
                    formatTimestamp(point.getRecordedAt(), zone),
                    point.getRecordedAt().getEpochSecond()
            );
        }
    }
}
