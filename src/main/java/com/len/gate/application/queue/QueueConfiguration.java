package com.len.gate.application.queue;

/**
 * 이벤트별로 해석된 대기열 설정.
 * queueEnabled=false 이면 maxConcurrent 는 Integer.MAX_VALUE 로 해석된다.
 */
public record QueueConfiguration(
        int maxConcurrent,
        int sessionTimeoutMinutes,
        int checkoutTimeoutMinutes,
        boolean queueEnabled
) {}
