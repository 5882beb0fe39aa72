package com.len.gate.infra.sse;

import com.len.gate.application.gate.QueueEvent;

public record QueueEventPayload(
        String type,              // promoted / position_changed / timeout_warning
        Integer oldPosition,
        Integer newPosition,
        Integer minutesRemaining
) {
    public static QueueEventPayload from(QueueEvent event) {
        return new QueueEventPayload(event.type().wireName(),
                event.oldPosition(), event.newPosition(), event.minutesRemaining());
    }
}
