package com.example.cryptorates.client;

import com.example.cryptorates.domain.CryptoPair;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 외부 시세 제공처 클라이언트
 * 저장소/캐시에 접근하지 않고 외부 호출만 수행한다.
 */
public interface PriceSourceClient {

    /**
     * 단일 거래쌍 현재가
     * @throws PriceSourceException 호출 실패 또는 잘못된 응답
     */
    BigDecimal getCurrentPrice(CryptoPair pair);

    /**
     * 단일 거래쌍 현재가 (외부 표기로 조회)
     * @throws UnsupportedPairException 지원하지 않는 거래쌍 (외부 호출 없음)
     */
    default BigDecimal getCurrentPrice(String pairSymbol) {
        return getCurrentPrice(CryptoPair.fromSymbol(pairSymbol));
    }

    /**
     * 지원 거래쌍 전체를 한 번에 조회
     * 잘못된 항목은 제외하고, 남는 항목이 없을 때만 실패한다.
     */
    Map<CryptoPair, BigDecimal> getAllCurrentPrices();

    /**
     * 가용성 확인 (예외를 던지지 않음)
     */
    boolean isAvailable();
}
