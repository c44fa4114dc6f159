package com.example.cryptorates.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * 캐시 저장소
 *
 * 조회/저장을 분리한 인터페이스라 Cache-Aside 분기는 호출자가 직접 작성한다.
 * SingleFlight 가 없으므로 같은 키에 동시에 미스가 나면 각자 원천을 조회하고 각자 저장한다.
 * 백엔드 오류는 모두 로그만 남기고 미스로 취급한다.
 */
public interface RateCache {

    <T> Optional<CachedValue<T>> get(String key, Class<T> type);

    <T> void set(String key, T value, Duration ttl);

    /**
     * 데이터 없음 결과 저장 (Penetration 방지)
     */
    void setNoData(String key, Duration ttl);

    void delete(Collection<String> keys);

    /**
     * 캐시 조회 결과. value 가 null 이면 "데이터 없음"이 캐싱된 것
     */
    record CachedValue<T>(T value) {

        public static <T> CachedValue<T> noData() {
            return new CachedValue<>(null);
        }

        public boolean isNoData() {
            return value == null;
        }
    }
}
