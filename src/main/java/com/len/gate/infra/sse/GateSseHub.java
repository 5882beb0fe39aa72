package com.len.gate.infra.sse;

import com.len.gate.application.gate.AdmissionGate;
import com.len.gate.application.gate.AdmissionGateFactory;
import com.len.gate.application.gate.ChangeNotificationBridge;
import com.len.gate.application.gate.GateState;
import com.len.gate.infra.config.GateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * eventId 별 SSE 연결 보관.
 * 연결 하나 = 호출자 하나: AdmissionGate + (입장 전까지) ChangeNotificationBridge.
 *
 * 이벤트
 * - hello    : 연결 확인
 * - status   : GateState 가 다시 계산될 때마다
 * - queue    : promoted / position_changed / timeout_warning
 * - admitted : 입장 확정 (1회)
 * - ping     : keep-alive
 *
 * 클라이언트가 끊기는 건 정상 상황 -> send 실패 시 연결 정리
 */
@Slf4j
@Component
public class GateSseHub {

    private final AdmissionGateFactory gateFactory;
    private final long streamTimeoutMs;

    // eventId -> connections
    private final Map<UUID, CopyOnWriteArrayList<GateConnection>> room = new ConcurrentHashMap<>();

    public GateSseHub(AdmissionGateFactory gateFactory, GateProperties properties) {
        this.gateFactory = gateFactory;
        this.streamTimeoutMs = properties.streamTimeout().toMillis();
    }

    public SseEmitter subscribe(UUID eventId, String userSessionId) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        GateConnection conn = new GateConnection(eventId, userSessionId, emitter);

        AdmissionGate gate = gateFactory.create(eventId, userSessionId,
                event -> send(conn, "queue", QueueEventPayload.from(event)),
                state -> onState(conn, state));
        ChangeNotificationBridge bridge = gateFactory.bridge(eventId, gate::recheck);
        conn.attach(gate, bridge);

        room.computeIfAbsent(eventId, k -> new CopyOnWriteArrayList<>()).add(conn);

        Runnable cleanup = () -> remove(conn);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(ex -> cleanup.run());

        if (!send(conn, "hello", Map.of("ok", true, "eventId", eventId.toString()))) {
            return emitter;
        }

        GateState initial = gate.checkStatus();
        if (!initial.canAccess() && !conn.isClosed()) {
            bridge.start();
        }
        return emitter;
    }

    public void pingAll() {
        Map<String, String> payload = Map.of("at", LocalDateTime.now().toString());
        for (List<GateConnection> connections : room.values()) {
            for (GateConnection conn : connections) {
                send(conn, "ping", payload);
            }
        }
    }

    /**
     * 입장한 연결은 bridge 가 없으므로 주기적으로 상태를 다시 읽는다 (timeout_warning 용)
     */
    public void refreshAdmitted() {
        for (List<GateConnection> connections : room.values()) {
            for (GateConnection conn : connections) {
                if (conn.isAdmitted() && !conn.isClosed()) {
                    conn.gate().checkStatus();
                }
            }
        }
    }

    public int connectionCount() {
        return room.values().stream().mapToInt(List::size).sum();
    }

    private void onState(GateConnection conn, GateState state) {
        send(conn, "status", state);
        if (state.canAccess() && conn.markAdmitted()) {
            // 입장 후에는 변경 알림이 필요 없다
            conn.bridge().stop();
            send(conn, "admitted", Map.of("eventId", conn.eventId().toString()));
        }
    }

    private boolean send(GateConnection conn, String name, Object payload) {
        if (conn.isClosed()) return false;
        try {
            conn.emitter().send(SseEmitter.event().name(name).data(payload));
            return true;
        } catch (IOException | IllegalStateException e) {
            // 끊긴 연결은 정리 (정상 상황)
            remove(conn);
            return false;
        }
    }

    private void remove(GateConnection conn) {
        if (!conn.close()) return;

        CopyOnWriteArrayList<GateConnection> list = room.get(conn.eventId());
        if (list != null) {
            list.remove(conn);
            if (list.isEmpty()) {
                room.remove(conn.eventId(), list);
            }
        }
        ChangeNotificationBridge bridge = conn.bridge();
        if (bridge != null) {
            bridge.stop();
        }
        try {
            conn.emitter().complete();
        } catch (IllegalStateException e) {
            log.debug("Emitter already completed. eventId={}, session={}", conn.eventId(), conn.userSessionId());
        }
    }
}
