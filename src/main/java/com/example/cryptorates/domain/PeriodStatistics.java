package com.example.cryptorates.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * DB 집계(min/max/avg/count) 결과
 * 넓은 구간에서도 시세 전체를 메모리에 올리지 않도록 저장소에서 계산한다.
 */
public record PeriodStatistics(
        BigDecimal minPrice,
        BigDecimal maxPrice,
        BigDecimal avgPrice,
        long totalRecords
) {

    /**
     * @param sum   구간 가격 합계
     * @param count 구간 건수 (0 이면 빈 통계)
     */
    public static PeriodStatistics of(BigDecimal min, BigDecimal max, BigDecimal sum, long count) {
        if (count == 0 || sum == null) {
            return empty();
        }
        BigDecimal avg = sum.divide(BigDecimal.valueOf(count), RatePoint.PRICE_SCALE, RoundingMode.HALF_UP);
        return new PeriodStatistics(scaled(min), scaled(max), avg, count);
    }

    public static PeriodStatistics empty() {
        return new PeriodStatistics(null, null, null, 0L);
    }

    public boolean isEmpty() {
        return totalRecords == 0;
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value == null ? null : value.setScale(RatePoint.PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
