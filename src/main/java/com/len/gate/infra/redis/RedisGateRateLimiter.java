package com.len.gate.infra.redis;

import com.len.gate.infra.config.GateProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * 세션별 고정 윈도우 카운터 (기본 10초에 20회).
 * Redis 장애 시에는 막지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisGateRateLimiter {

    private final StringRedisTemplate redis;
    private final GateProperties properties;

    public boolean tryAcquire(String userSessionId) {
        GateProperties.RateLimit limit = properties.rateLimit();
        String key = GateRedisKeys.rateKey(userSessionId);
        try {
            Long count = redis.opsForValue().increment(key);
            if (count == null) {
                return true;
            }
            if (count == 1L) {
                redis.expire(key, limit.window());
            }
            return count <= limit.maxRequests();
        } catch (RuntimeException e) {
            log.warn("[RateLimit] redis unavailable, allowing request. session={}", userSessionId, e);
            return true;
        }
    }
}
