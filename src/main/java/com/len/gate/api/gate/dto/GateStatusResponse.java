package com.len.gate.api.gate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.len.gate.application.gate.GateState;
import com.len.gate.application.queue.QueueDisplayFormatter;

public record GateStatusResponse(
        boolean canAccess,
        Integer queuePosition,
        long waitingCount,
        long activeCount,
        @JsonProperty("isChecking") boolean checking,
        int estimatedWaitMinutes,
        String queuePositionLabel,   // "3rd" (대기 중일 때만)
        String estimatedWaitLabel,   // "About 10 minutes" (대기 중일 때만)
        Integer progressPercentage
) {
    public static GateStatusResponse from(GateState s) {
        if (s.queuePosition() == null) {
            return new GateStatusResponse(s.canAccess(), null, s.waitingCount(), s.activeCount(),
                    s.checking(), s.estimatedWaitMinutes(), null, null, null);
        }
        int position = s.queuePosition();
        return new GateStatusResponse(
                s.canAccess(),
                position,
                s.waitingCount(),
                s.activeCount(),
                s.checking(),
                s.estimatedWaitMinutes(),
                QueueDisplayFormatter.formatQueuePosition(position),
                QueueDisplayFormatter.formatWaitTime(s.estimatedWaitMinutes()),
                QueueDisplayFormatter.progressPercentage(position, s.waitingCount())
        );
    }
}
