package com.len.gate.infra.redis;

import java.util.UUID;

public final class GateRedisKeys {

    public static final String CHANGE_CHANNEL_PREFIX = "gate:changes:";   // pub/sub: gate:changes:{eventId}
    public static final String ADMISSION_LOCK_PREFIX = "gate:lock:";      // 이벤트별 입장 판정 락
    public static final String RATE_PREFIX = "gate:rate:";                // 세션별 요청 카운터

    // 스케줄러 락(전역)
    public static final String REAPER_LOCK_KEY = "gate:reaper:lock";

    private GateRedisKeys() {}

    public static String changeChannel(UUID eventId) {
        return CHANGE_CHANNEL_PREFIX + eventId;
    }

    public static String admissionLockKey(UUID eventId) {
        return ADMISSION_LOCK_PREFIX + eventId;
    }

    public static String rateKey(String userSessionId) {
        return RATE_PREFIX + userSessionId;
    }
}
