package com.len.gate.application.gate;

/**
 * 순번 변동 알림 기준
 * - 새 순번이 10 이하면 바뀔 때마다 알림
 * - 그 외에는 |old - new| >= min(ceil(old * 5%), 20) 일 때만
 */
public final class PositionChangePolicy {

    static final int ALWAYS_NOTIFY_WITHIN = 10;
    static final int MAX_STEP = 20;

    private PositionChangePolicy() {}

    public static boolean shouldNotify(int oldPosition, int newPosition) {
        if (oldPosition == newPosition) {
            return false;
        }
        if (newPosition <= ALWAYS_NOTIFY_WITHIN) {
            return true;
        }
        return Math.abs(oldPosition - newPosition) >= threshold(oldPosition);
    }

    static int threshold(int oldPosition) {
        int fivePercent = (oldPosition * 5 + 99) / 100;   // ceil(5%)
        return Math.max(1, Math.min(fivePercent, MAX_STEP));
    }
}
