package com.example.cryptorates.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;

/**
 * 구간 시세 통계 (저장하지 않고 매번 계산)
 *
 * priceChange 는 recordedAt 기준 첫 시세 → 마지막 시세 차이.
 * 저장/삽입 순서와 무관하게 시간순으로 정렬한 뒤 계산한다.
 */
public record RateStatistics(
        BigDecimal minPrice,
        BigDecimal maxPrice,
        BigDecimal avgPrice,
        int totalRecords,
        BigDecimal priceChange,
        BigDecimal priceChangePercent
) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PERCENT_CALC_SCALE = 8;

    public static RateStatistics from(List<RatePoint> points) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute statistics from an empty rate set");
        }

        List<RatePoint> ordered = points.stream()
                .sorted(Comparator.comparing(RatePoint::getRecordedAt))
                .toList();

        BigDecimal min = ordered.get(0).getPrice();
        BigDecimal max = min;
        BigDecimal sum = BigDecimal.ZERO;
        for (RatePoint point : ordered) {
            BigDecimal price = point.getPrice();
            min = min.min(price);
            max = max.max(price);
            sum = sum.add(price);
        }
        BigDecimal avg = sum.divide(BigDecimal.valueOf(ordered.size()), RatePoint.PRICE_SCALE, RoundingMode.HALF_UP);

        BigDecimal first = ordered.get(0).getPrice();
        BigDecimal last = ordered.get(ordered.size() - 1).getPrice();
        BigDecimal change = last.subtract(first);

        return new RateStatistics(
                min.setScale(RatePoint.PRICE_SCALE, RoundingMode.HALF_UP),
                max.setScale(RatePoint.PRICE_SCALE, RoundingMode.HALF_UP),
                avg,
                ordered.size(),
                change.setScale(RatePoint.PRICE_SCALE, RoundingMode.HALF_UP),
                changePercent(first, change)
        );
    }

    // 첫 가격이 0이면 0%
    static BigDecimal changePercent(BigDecimal first, BigDecimal change) {
        if (first.signum() == 0) {
            return BigDecimal.ZERO.setScale(PERCENT_CALC_SCALE);
        }
        return change.multiply(HUNDRED).divide(first, PERCENT_CALC_SCALE, RoundingMode.HALF_UP);
    }
}
