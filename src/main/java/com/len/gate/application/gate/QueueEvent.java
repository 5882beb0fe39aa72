package com.len.gate.application.gate;

/**
 * 대기열 알림.
 * - PROMOTED        : 대기 → 입장
 * - POSITION_CHANGED: 순번 변동 (oldPosition/newPosition)
 * - TIMEOUT_WARNING : 세션 만료 임박 (minutesRemaining)
 */
public record QueueEvent(
        Type type,
        Integer oldPosition,
        Integer newPosition,
        Integer minutesRemaining
) {

    public enum Type {
        PROMOTED, POSITION_CHANGED, TIMEOUT_WARNING;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static QueueEvent promoted(Integer lastPosition) {
        return new QueueEvent(Type.PROMOTED, lastPosition, null, null);
    }

    public static QueueEvent positionChanged(int oldPosition, int newPosition) {
        return new QueueEvent(Type.POSITION_CHANGED, oldPosition, newPosition, null);
    }

    public static QueueEvent timeoutWarning(int minutesRemaining) {
        return new QueueEvent(Type.TIMEOUT_WARNING, null, null, minutesRemaining);
    }
}
