package com.len.gate.infra.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * application.yml 의 ticketing.gate.* 바인딩
 */
@ConfigurationProperties(prefix = "ticketing.gate")
public record GateProperties(
        @DefaultValue("50") int defaultMaxConcurrent,
        @DefaultValue("30") int defaultSessionTimeoutMinutes,
        @DefaultValue("10") int defaultCheckoutTimeoutMinutes,
        @DefaultValue("5") int averageServiceMinutes,
        @DefaultValue("2") int timeoutWarningMinutes,
        @DefaultValue("3s") Duration pollInterval,
        @DefaultValue("10s") Duration subscribeTimeout,
        @DefaultValue("30m") Duration streamTimeout,
        @DefaultValue Lock lock,
        @DefaultValue RateLimit rateLimit
) {

    public record Lock(
            @DefaultValue("5s") Duration ttl,
            @DefaultValue("40") int retryCount,
            @DefaultValue("50ms") Duration retryDelay
    ) {}

    public record RateLimit(
            @DefaultValue("20") int maxRequests,
            @DefaultValue("10s") Duration window
    ) {}

    // 테스트/수동 구성용 (application.yml 기본값과 동일)
    public static GateProperties defaults() {
        return new GateProperties(50, 30, 10, 5, 2,
                Duration.ofSeconds(3), Duration.ofSeconds(10), Duration.ofMinutes(30),
                new Lock(Duration.ofSeconds(5), 40, Duration.ofMillis(50)),
                new RateLimit(20, Duration.ofSeconds(10)));
    }
}
