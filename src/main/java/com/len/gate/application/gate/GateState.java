package com.len.gate.application.gate;

/**
 * 호출자 로컬 상태. 상태 조회마다 통째로 다시 계산된다.
 */
public record GateState(
        boolean canAccess,
        Integer queuePosition,
        long waitingCount,
        long activeCount,
        boolean checking,
        int estimatedWaitMinutes
) {

    public static GateState initial() {
        return new GateState(false, null, 0, 0, true, 0);
    }

    // store 장애 시: 입장 불가, 확인 중 아님
    public static GateState unavailable() {
        return new GateState(false, null, 0, 0, false, 0);
    }

    public GateState withChecking(boolean checking) {
        return new GateState(canAccess, queuePosition, waitingCount, activeCount, checking, estimatedWaitMinutes);
    }

    public boolean isWaiting() {
        return queuePosition != null;
    }
}
