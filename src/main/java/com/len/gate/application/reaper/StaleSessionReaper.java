package com.len.gate.application.reaper;

import com.len.gate.application.queue.QueueConfiguration;
import com.len.gate.application.queue.QueueConfigurationResolver;
import com.len.gate.domain.session.TicketingSessionStore;
import com.len.gate.infra.redis.GateRedisKeys;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 타임아웃된 active/waiting 세션을 completed 로 일괄 전환.
 * 승격은 하지 않는다 (다음 recheck/enter 에서 채워짐).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleSessionReaper {

    private final TicketingSessionStore sessionStore;
    private final QueueConfigurationResolver configResolver;
    private final StringRedisTemplate redis;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // false 면 스케줄 sweep 만 끈다 (cleanup 요청은 동작)
    @Value("${ticketing.gate.reaper.enabled:true}")
    private boolean enabled;

    // 여러 노드 중 한 곳만 sweep
    @Value("${ticketing.gate.reaper.lock-ttl-ms:60000}")
    private long lockTtlMs;

    private final RedisScript<Long> unlockScript = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) else return 0 end",
            Long.class
    );

    @Scheduled(fixedDelayString = "${ticketing.gate.reaper.interval-ms:300000}",
            initialDelayString = "${ticketing.gate.reaper.initial-delay-ms:60000}")
    public void sweepTick() {
        if (!enabled) return;

        String lockVal = UUID.randomUUID().toString();
        Boolean locked;
        try {
            locked = redis.opsForValue().setIfAbsent(
                    GateRedisKeys.REAPER_LOCK_KEY, lockVal, lockTtlMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.warn("[StaleSessionReaper] lock unavailable, skip tick", e);
            return;
        }
        if (locked == null || !locked) return;

        final long startNs = System.nanoTime();
        try {
            List<UUID> eventIds = sessionStore.findEventIdsWithOpenSessions();
            int total = 0;
            for (UUID eventId : eventIds) {
                try {
                    total += sweep(eventId);
                } catch (RuntimeException e) {
                    // 한 이벤트 실패가 나머지를 막지 않게
                    log.warn("[StaleSessionReaper] sweep failed. eventId={}", eventId, e);
                    meterRegistry.counter("ticketing.gate.reaper.failures").increment();
                }
            }
            if (total > 0) {
                log.info("[StaleSessionReaper] events={}, expired={}", eventIds.size(), total);
            }
        } catch (RuntimeException e) {
            log.warn("[StaleSessionReaper] failed", e);
            meterRegistry.counter("ticketing.gate.reaper.failures").increment();
        } finally {
            meterRegistry.timer("ticketing.gate.reaper.tick")
                    .record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
            try {
                redis.execute(unlockScript, List.of(GateRedisKeys.REAPER_LOCK_KEY), lockVal);
            } catch (RuntimeException e) {
                log.warn("[StaleSessionReaper] unlock failed, lock will expire in {}ms", lockTtlMs, e);
            }
        }
    }

    /**
     * 이벤트 하나 sweep (스케줄 / cleanup 요청 공용)
     * @return 만료 처리된 세션 수
     */
    public int sweep(UUID eventId) {
        QueueConfiguration config = configResolver.resolve(eventId);
        LocalDateTime cutoff = LocalDateTime.now(clock).minusMinutes(config.sessionTimeoutMinutes());

        int expired = sessionStore.expireOlderThan(eventId, cutoff);
        if (expired > 0) {
            meterRegistry.counter("ticketing.gate.reaper.expired").increment(expired);
            log.info("[StaleSessionReaper] eventId={}, cutoff={}, expired={}", eventId, cutoff, expired);
        }
        return expired;
    }
}
