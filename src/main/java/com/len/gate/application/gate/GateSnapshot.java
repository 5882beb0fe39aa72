package com.len.gate.application.gate;

import com.len.gate.domain.session.SessionStatus;

import java.time.LocalDateTime;

/**
 * 한 번의 상태 조회 결과 (store 기준).
 * 본인 세션이 없으면 status/createdAt/enteredAt/queuePosition 은 null.
 */
public record GateSnapshot(
        SessionStatus status,
        LocalDateTime createdAt,
        LocalDateTime enteredAt,
        Integer queuePosition,
        long activeCount,
        long waitingCount
) {

    public static GateSnapshot noSession(long activeCount, long waitingCount) {
        return new GateSnapshot(null, null, null, null, activeCount, waitingCount);
    }

    public boolean hasSession() {
        return status != null;
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public boolean isWaiting() {
        return status == SessionStatus.WAITING;
    }
}
