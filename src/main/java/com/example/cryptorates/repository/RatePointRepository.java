package com.example.cryptorates.repository;

import com.example.cryptorates.domain.CryptoPair;
import com.example.cryptorates.domain.RatePoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RatePointRepository extends JpaRepository<RatePoint, Long> {

    boolean existsByPairAndRecordedAt(CryptoPair pair, Instant recordedAt);

    List<RatePoint> findByPairAndRecordedAtBetweenOrderByRecordedAtAsc(CryptoPair pair, Instant start, Instant end);

    Optional<RatePoint> findFirstByPairOrderByRecordedAtDesc(CryptoPair pair);

    @Query("""
           select new com.example.cryptorates.repository.PriceAggregate(
                  min(r.price), max(r.price), sum(r.price), count(r))
           from RatePoint r
           where r.pair = :pair
             and r.recordedAt >= :start
             and r.recordedAt <= :end
           """)
    PriceAggregate aggregate(@Param("pair") CryptoPair pair,
                               @Param("start") Instant start,
                               @Param("end") Instant end);

    @Transactional
    @Modifying
    @Query("delete from RatePoint r where r.recordedAt < :cutoff")
    int deleteRecordedBefore(@Param("cutoff") Instant cutoff);
}
