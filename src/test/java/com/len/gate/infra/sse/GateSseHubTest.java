package com.len.gate.infra.sse;

import com.len.gate.application.gate.AdmissionGate;
import com.len.gate.application.gate.AdmissionGateFactory;
import com.len.gate.application.gate.ChangeNotificationBridge;
import com.len.gate.application.gate.GateState;
import com.len.gate.application.gate.QueueEventListener;
import com.len.gate.infra.config.GateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class GateSseHubTest {

    @Mock AdmissionGateFactory gateFactory;
    @Mock AdmissionGate gate;
    @Mock ChangeNotificationBridge bridge;

    final UUID eventId = UUID.randomUUID();
    final String sessionId = "session-1-a";

    GateSseHub hub;

    @BeforeEach
    void setUp() {
        hub = new GateSseHub(gateFactory, GateProperties.defaults());
        given(gateFactory.create(eq(eventId), eq(sessionId), any(QueueEventListener.class), any()))
                .willReturn(gate);
        given(gateFactory.bridge(eq(eventId), any(Runnable.class))).willReturn(bridge);
    }

    @SuppressWarnings("unchecked")
    private Consumer<GateState> stateListener() {
        ArgumentCaptor<Consumer<GateState>> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(gateFactory).create(eq(eventId), eq(sessionId), any(QueueEventListener.class), captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("대기 중으로 연결되면 bridge 를 시작한다")
    void subscribe_waiting_startsBridge() {
        given(gate.checkStatus()).willReturn(new GateState(false, 4, 10, 50, false, 20));

        hub.subscribe(eventId, sessionId);

        verify(bridge).start();
        assertThat(hub.connectionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("이미 입장한 상태로 연결되면 bridge 없이 admitted")
    void subscribe_admitted_noBridge() {
        given(gate.checkStatus()).willAnswer(inv -> {
            GateState admitted = new GateState(true, null, 0, 1, false, 0);
            stateListener().accept(admitted);
            return admitted;
        });

        hub.subscribe(eventId, sessionId);

        verify(bridge).stop();
        verify(bridge, never()).start();
    }

    @Test
    @DisplayName("대기 중 승격되면 bridge 를 한 번만 내린다")
    void promotedLater_stopsBridgeOnce() {
        given(gate.checkStatus()).willReturn(new GateState(false, 1, 1, 50, false, 5));
        hub.subscribe(eventId, sessionId);

        Consumer<GateState> listener = stateListener();
        listener.accept(new GateState(true, null, 0, 50, false, 0));
        listener.accept(new GateState(true, null, 0, 50, false, 0));

        verify(bridge, times(1)).stop();
    }

    @Test
    @DisplayName("입장한 연결만 주기적으로 상태를 다시 읽는다")
    void refreshAdmitted_onlyAdmitted() {
        given(gate.checkStatus()).willReturn(new GateState(false, 2, 2, 50, false, 10));
        hub.subscribe(eventId, sessionId);

        hub.refreshAdmitted();
        verify(gate, times(1)).checkStatus();

        stateListener().accept(new GateState(true, null, 1, 50, false, 0));
        hub.refreshAdmitted();
        verify(gate, times(2)).checkStatus();
    }
}
