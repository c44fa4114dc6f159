package com.example.cryptorates.repository;

import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.domain.PeriodStatistics;
import com.example.cryptorates.domain.RatePoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA 기반 시세 저장소
 *
 * 존재 여부를 먼저 확인하고 insert 하면 동시 적재 시 경합 구간이 생기므로,
 * insert 를 바로 시도하고, 제약 위반 후 같은 (pair, recordedAt) 행이 있을 때만 SKIPPED 로 처리한다.
 * 호출자는 트랜잭션 밖에서 호출해야 한다 (실패한 insert 가 바깥 트랜잭션을 오염시키지 않도록).
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaRateStore implements RateStore {

    private final RatePointRepository repository;

    @Override
    public SaveResult save(RatePoint point) {
        try {
            repository.saveAndFlush(point);
            log.debug("[시세 저장] pair={}, recordedAt={}", point.getPair().getSymbol(), point.getRecordedAt());
            return SaveResult.SAVED;
        } catch (DataIntegrityViolationException e) {
            // 유니크 제약 외의 위반(길이 초과, NOT NULL 등)은 중복이 아니므로 그대로 실패
            if (!repository.existsByPairAndRecordedAt(point.getPair(), point.getRecordedAt())) {
                log.warn("[시세 저장 실패] pair={}, recordedAt={}, error={}",
                        point.getPair().getSymbol(), point.getRecordedAt(), e.getMostSpecificCause().getMessage());
                throw e;
            }
            log.info("[중복 시세 건너뜀] pair={}, recordedAt={}", point.getPair().getSymbol(), point.getRecordedAt());
            return SaveResult.SKIPPED;
        }
    }

    @Override
    public boolean existsForPairAndTime(CryptoPair pair, Instant recordedAt) {
        return repository.existsByPairAndRecordedAt(pair, recordedAt);
    }

    @Override
    public List<RatePoint> findRange(CryptoPair pair, Instant start, Instant end) {
        return repository.findByPairAndRecordedAtBetweenOrderByRecordedAtAsc(pair, start, end);
    }

    @Override
    public Optional<RatePoint> findLatest(CryptoPair pair) {
        return repository.findFirstByPairOrderByRecordedAtDesc(pair);
    }

    @Override
    public PeriodStatistics computeStatistics(CryptoPair pair, Instant start, Instant end) {
        PriceAggregate aggregate = repository.aggregate(pair, start, end);
        if (aggregate == null || aggregate.count() == null) {
            return PeriodStatistics.empty();
        }
        return PeriodStatistics.of(aggregate.minPrice(), aggregate.maxPrice(), aggregate.sumPrice(), aggregate.count());
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        int deleted = repository.deleteRecordedBefore(cutoff);
        log.info("[오래된 시세 삭제] cutoff={}, deleted={}", cutoff, deleted);
        return deleted;
    }
}
