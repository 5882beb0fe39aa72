package com.len.gate.infra.redis;

import com.len.gate.application.gate.AdmissionLock;
import com.len.gate.application.gate.AdmissionLockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 이벤트별 입장 판정(count -> insert/promote)을 직렬화하는 Redis 락.
 * - SETNX + TTL 로 획득
 * - 소유권 확인 후 삭제(Lua)로 해제
 */
@Slf4j
public class RedisAdmissionLock implements AdmissionLock {

    private final StringRedisTemplate redis;
    private final Duration ttl;
    private final int retryCount;
    private final long retryDelayMs;

    private final RedisScript<Long> unlockScript = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) else return 0 end",
            Long.class
    );

    public RedisAdmissionLock(StringRedisTemplate redis, Duration ttl, int retryCount, Duration retryDelay) {
        this.redis = redis;
        this.ttl = ttl;
        this.retryCount = Math.max(retryCount, 1);
        this.retryDelayMs = retryDelay.toMillis();
    }

    @Override
    public <T> T executeWithLock(UUID eventId, Supplier<T> action) {
        String key = GateRedisKeys.admissionLockKey(eventId);
        String lockVal = UUID.randomUUID().toString();

        for (int attempt = 1; attempt <= retryCount; attempt++) {
            Boolean locked = redis.opsForValue().setIfAbsent(key, lockVal, ttl);
            if (Boolean.TRUE.equals(locked)) {
                try {
                    return action.get();
                } finally {
                    Long released = redis.execute(unlockScript, List.of(key), lockVal);
                    if (released == null || released == 0L) {
                        log.warn("[AdmissionLock] release skipped (expired or stolen). key={}", key);
                    }
                }
            }
            if (attempt < retryCount) {
                sleep(retryDelayMs);
            }
        }
        throw new AdmissionLockException(eventId, retryCount);
    }

    @Override
    public String name() {
        return "redis";
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdmissionLockException("interrupted while waiting for admission lock", e);
        }
    }
}
