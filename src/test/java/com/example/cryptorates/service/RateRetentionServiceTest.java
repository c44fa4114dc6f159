package com.example.cryptorates.service;

import com.example.cryptorates.config.RateProperties;
import com.example.cryptorates.repository.RateStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("RateRetentionService 테스트")
class RateRetentionServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T03:30:00Z");

    private final RateStore rateStore = mock(RateStore.class);

    @Test
    @DisplayName("보관 일수 이전 시세를 삭제한다")
    void purgesByRetentionDays() {
        RateProperties properties = new RateProperties();
        properties.setRetentionDays(30);
        given(rateStore.deleteOlderThan(any())).willReturn(12);
        RateRetentionService service = new RateRetentionService(rateStore, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        int deleted = service.purgeExpired();

        assertThat(deleted).isEqualTo(12);
        verify(rateStore).deleteOlderThan(Instant.parse("2023-12-16T03:30:00Z"));
    }

    @Test
    @DisplayName("저장소 오류는 RateServiceException")
    void wrapsStoreFailure() {
        given(rateStore.deleteOlderThan(any())).willThrow(new IllegalStateException("db down"));
        RateRetentionService service = new RateRetentionService(rateStore, new RateProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThatThrownBy(service::purgeExpired).isInstanceOf(RateServiceException.class);
    }
}
