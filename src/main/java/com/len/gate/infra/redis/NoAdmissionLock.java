package com.len.gate.infra.redis;

import com.len.gate.application.gate.AdmissionLock;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * 락 없이 바로 실행 (check-then-insert 경쟁 허용).
 * ticketing.gate.strict-capacity=false 일 때만 사용.
 */
public class NoAdmissionLock implements AdmissionLock {

    @Override
    public <T> T executeWithLock(UUID eventId, Supplier<T> action) {
        return action.get();
    }

    @Override
    public String name() {
        return "none";
    }
}
