package com.len.gate.application.queue;

import com.len.gate.infra.config.GateProperties;
import org.springframework.stereotype.Component;

/**
 * 예상 대기 시간(분)
 * ceil(position / max(maxConcurrent - activeCount, 1)) * averageServiceMinutes
 */
@Component
public class WaitTimeEstimator {

    private final int averageServiceMinutes;

    public WaitTimeEstimator(GateProperties properties) {
        this(properties.averageServiceMinutes());
    }

    WaitTimeEstimator(int averageServiceMinutes) {
        if (averageServiceMinutes < 1) {
            throw new IllegalArgumentException("averageServiceMinutes must be >= 1: " + averageServiceMinutes);
        }
        this.averageServiceMinutes = averageServiceMinutes;
    }

    public int estimate(Integer position, long activeCount, int maxConcurrent) {
        if (position == null || position <= 0) {
            return 0;
        }
        long freeSlots = Math.max((long) maxConcurrent - activeCount, 1L);
        long batches = (position + freeSlots - 1) / freeSlots;
        long minutes = batches * averageServiceMinutes;
        return (int) Math.max(1L, Math.min(minutes, Integer.MAX_VALUE));
    }
}
