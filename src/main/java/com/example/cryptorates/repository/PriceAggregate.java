package com.example.cryptorates.repository;

import java.math.BigDecimal;

/**
 * JPQL 집계 원본 값. 평균은 sum / count 로 BigDecimal 에서 계산한다 (AVG 는 Double 로 반환되어 정밀도 손실).
 */
public record PriceAggregate(BigDecimal minPrice, BigDecimal maxPrice, BigDecimal sumPrice, Long count) {
}
