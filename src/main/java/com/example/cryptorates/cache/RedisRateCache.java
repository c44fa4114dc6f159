package com.example.cryptorates.cache;

import com.example.cryptorates.metrics.RateMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Redis 캐시 구현 (값은 JSON 문자열)
 * 캐시는 보조 수단이므로 Redis 장애가 조회 실패로 이어지지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisRateCache implements RateCache {

    static final String NULL_MARKER = "__NULL__";

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final RateMetrics rateMetrics;

    @Override
    public <T> Optional<CachedValue<T>> get(String key, Class<T> type) {
        try {
            String cached = stringRedisTemplate.opsForValue().get(key);
            if (cached == null) {
                log.debug("[캐시 미스] key={}", key);
                return Optional.empty();
            }
            if (NULL_MARKER.equals(cached)) {
                log.debug("[Null 캐시 히트] key={}", key);
                return Optional.of(CachedValue.noData());
            }
            log.debug("[캐시 히트] key={}", key);
            return Optional.of(new CachedValue<>(objectMapper.readValue(cached, type)));
        } catch (Exception e) {
            log.warn("[캐시 조회 실패] 미스로 처리 - key={}, error={}", key, e.getMessage());
            rateMetrics.recordCacheError("get");
            return Optional.empty();
        }
    }

    @Override
    public <T> void set(String key, T value, Duration ttl) {
        try {
            stringRedisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
            log.debug("[캐시 저장] key={}, ttl={}s", key, ttl.getSeconds());
        } catch (Exception e) {
            log.warn("[캐시 저장 실패] key={}, error={}", key, e.getMessage());
            rateMetrics.recordCacheError("set");
        }
    }

    @Override
    public void setNoData(String key, Duration ttl) {
        try {
            stringRedisTemplate.opsForValue().set(key, NULL_MARKER, ttl);
            log.debug("[Null 캐시 저장] key={}, ttl={}s", key, ttl.getSeconds());
        } catch (Exception e) {
            log.warn("[Null 캐시 저장 실패] key={}, error={}", key, e.getMessage());
            rateMetrics.recordCacheError("set_no_data");
        }
    }

    @Override
    public void delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        try {
            Long deleted = stringRedisTemplate.delete(keys);
            log.debug("[캐시 삭제] keys={}, deleted={}", keys, deleted);
        } catch (Exception e) {
            log.warn("[캐시 삭제 실패] keys={}, error={}", keys, e.getMessage());
            rateMetrics.recordCacheError("delete");
        }
    }
}
