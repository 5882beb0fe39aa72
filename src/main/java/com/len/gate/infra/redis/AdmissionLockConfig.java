package com.len.gate.infra.redis;

import com.len.gate.application.gate.AdmissionLock;
import com.len.gate.infra.config.GateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * ticketing.gate.strict-capacity
 * - true(기본) → RedisAdmissionLock : 이벤트별 입장 판정 직렬화
 * - false      → NoAdmissionLock    : 동시 입장 시 maxConcurrent 초과 허용
 */
@Slf4j
@Configuration
public class AdmissionLockConfig {

    @Bean
    @ConditionalOnProperty(name = "ticketing.gate.strict-capacity", havingValue = "true", matchIfMissing = true)
    public AdmissionLock redisAdmissionLock(StringRedisTemplate redis, GateProperties properties) {
        GateProperties.Lock lock = properties.lock();
        log.info("Creating RedisAdmissionLock - ttl={}, retryCount={}", lock.ttl(), lock.retryCount());
        return new RedisAdmissionLock(redis, lock.ttl(), lock.retryCount(), lock.retryDelay());
    }

    @Bean
    @ConditionalOnProperty(name = "ticketing.gate.strict-capacity", havingValue = "false")
    public AdmissionLock noAdmissionLock() {
        log.info("Creating NoAdmissionLock - admission races may overshoot maxConcurrent");
        return new NoAdmissionLock();
    }
}
