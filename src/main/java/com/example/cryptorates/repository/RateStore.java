package com.example.cryptorates.repository;

import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.domain.PeriodStatistics;
import com.example.cryptorates.domain.RatePoint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 시세 시계열 저장소 (추가 전용)
 * (pair, recordedAt) 당 한 건만 존재한다.
 */
public interface RateStore {

    enum SaveResult {
        SAVED,
        /**
         * 같은 (pair, recordedAt) 시세가 이미 존재
         */
        SKIPPED
    }

    /**
     * 멱등 저장. 중복 판정은 DB 유니크 제약에 맡긴다.
     */
    SaveResult save(RatePoint point);

    boolean existsForPairAndTime(CryptoPair pair, Instant recordedAt);

    /**
     * [start, end] 구간 시세, recordedAt 오름차순
     */
    List<RatePoint> findRange(CryptoPair pair, Instant start, Instant end);

    Optional<RatePoint> findLatest(CryptoPair pair);

    PeriodStatistics computeStatistics(CryptoPair pair, Instant start, Instant end);

    /**
     * @return 삭제 건수
     */
    int deleteOlderThan(Instant cutoff);
}
