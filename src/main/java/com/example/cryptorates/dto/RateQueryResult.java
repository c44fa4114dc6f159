package com.example.cryptorates.dto;

import com.example.cryptorates.domain.CryptoPair;

import java.util.Optional;

/**
 * 구간 조회 결과
 * 데이터가 없는 경우도 예외가 아니라 noData 로 명시적으로 표현한다.
 */
public final class RateQueryResult {

    private final CryptoPair pair;
    private final String requestedPeriod;
    private final RateReport report;

    private RateQueryResult(CryptoPair pair, String requestedPeriod, RateReport report) {
        this.pair = pair;
        this.requestedPeriod = requestedPeriod;
        this.report = report;
    }

    public static RateQueryResult found(CryptoPair pair, RateReport report) {
        return new RateQueryResult(pair, report.requestedPeriod(), report);
    }

    public static RateQueryResult noData(CryptoPair pair, String requestedPeriod) {
        return new RateQueryResult(pair, requestedPeriod, null);
    }

    public boolean isEmpty() {
        return report == null;
    }

    public CryptoPair getPair() {
        return pair;
    }

    public String getRequestedPeriod() {
        return requestedPeriod;
    }

    public Optional<RateReport> getReport() {
        return Optional.ofNullable(report);
    }
}
