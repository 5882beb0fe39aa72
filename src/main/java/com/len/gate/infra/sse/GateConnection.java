package com.len.gate.infra.sse;

import com.len.gate.application.gate.AdmissionGate;
import com.len.gate.application.gate.ChangeNotificationBridge;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

final class GateConnection {

    private final UUID eventId;
    private final String userSessionId;
    private final SseEmitter emitter;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean admitted = new AtomicBoolean(false);

    private volatile AdmissionGate gate;
    private volatile ChangeNotificationBridge bridge;

    GateConnection(UUID eventId, String userSessionId, SseEmitter emitter) {
        this.eventId = eventId;
        this.userSessionId = userSessionId;
        this.emitter = emitter;
    }

    void attach(AdmissionGate gate, ChangeNotificationBridge bridge) {
        this.gate = gate;
        this.bridge = bridge;
    }

    UUID eventId() { return eventId; }

    String userSessionId() { return userSessionId; }

    SseEmitter emitter() { return emitter; }

    AdmissionGate gate() { return gate; }

    ChangeNotificationBridge bridge() { return bridge; }

    boolean isClosed() { return closed.get(); }

    boolean isAdmitted() { return admitted.get(); }

    // 처음 닫을 때만 true
    boolean close() {
        return closed.compareAndSet(false, true);
    }

    // 처음 입장 확인 때만 true
    boolean markAdmitted() {
        return admitted.compareAndSet(false, true);
    }
}
