package com.example.cryptorates.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 거래쌍 시세 한 건 (불변)
 * (pair, recorded_at) 유니크 제약으로 중복 저장을 DB 단에서 차단
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Entity
@Table(
        name = "rates",
        indexes = {
                @Index(name = "idx_pair_recorded_at", columnList = "pair,recorded_at"),
                @Index(name = "idx_recorded_at", columnList = "recorded_at")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_pair_recorded_at", columnNames = {"pair", "recorded_at"})
        }
)
public class RatePoint {

    public static final int PRICE_SCALE = 8;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "pair", nullable = false, length = 10)
    private CryptoPair pair;

    @Column(name = "price", nullable = false, precision = 20, scale = PRICE_SCALE)
    private BigDecimal price;

    // 시세가 유효한 시점
    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    // 적재 시점 (적재 서비스가 Clock 기준으로 채움)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
