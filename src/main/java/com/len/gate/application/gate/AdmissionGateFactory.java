package com.len.gate.application.gate;

import com.len.gate.application.queue.QueueConfigurationResolver;
import com.len.gate.application.queue.WaitTimeEstimator;
import com.len.gate.domain.notify.SessionChangeFeed;
import com.len.gate.infra.config.GateProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Consumer;

@Component
@RequiredArgsConstructor
public class AdmissionGateFactory {

    private final TicketingGateService gateService;
    private final QueueConfigurationResolver configResolver;
    private final WaitTimeEstimator estimator;
    private final SessionChangeFeed changeFeed;
    private final TaskScheduler taskScheduler;
    private final GateProperties properties;
    private final Clock clock;

    // 요청 1회용 (이벤트 리스너 없음)
    public AdmissionGate create(UUID eventId, String userSessionId) {
        return create(eventId, userSessionId, QueueEventListener.NONE, s -> { });
    }

    public AdmissionGate create(UUID eventId, String userSessionId,
                                QueueEventListener eventListener, Consumer<GateState> stateListener) {
        return new AdmissionGate(eventId, userSessionId, gateService, configResolver, estimator, clock,
                properties.timeoutWarningMinutes(), eventListener, stateListener);
    }

    public ChangeNotificationBridge bridge(UUID eventId, Runnable recheck) {
        return new ChangeNotificationBridge(eventId, changeFeed, taskScheduler, clock,
                properties.pollInterval(), properties.subscribeTimeout(), recheck);
    }
}
