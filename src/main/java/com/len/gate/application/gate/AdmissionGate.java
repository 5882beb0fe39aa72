package com.len.gate.application.gate;

import com.len.gate.application.queue.QueueConfiguration;
import com.len.gate.application.queue.QueueConfigurationResolver;
import com.len.gate.application.queue.WaitTimeEstimator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * 호출자(브라우저 탭) 한 명의 입장 게이트.
 * <p>
 * 이전에 관측한 순번/대기 여부를 기억해서 promoted, position_changed, timeout_warning 을 낸다.
 * store 장애는 여기서 흡수한다: 입장 불가 + checking=false, 예외는 밖으로 나가지 않는다.
 */
@Slf4j
public class AdmissionGate {

    private final UUID eventId;
    private final String userSessionId;
    private final TicketingGateService gateService;
    private final QueueConfigurationResolver configResolver;
    private final WaitTimeEstimator estimator;
    private final Clock clock;
    private final int timeoutWarningMinutes;
    private final QueueEventListener eventListener;
    private final Consumer<GateState> stateListener;

    private volatile GateState state = GateState.initial();

    // 아래 필드는 checkStatus 안에서만 (synchronized)
    private boolean observedWaiting;
    private Integer lastPosition;
    private Integer lastNotifiedPosition;
    // timeout_warning 을 낸 세션 row 의 created_at (row 가 바뀌면 다시 낸다)
    private LocalDateTime warnedCreatedAt;

    AdmissionGate(UUID eventId, String userSessionId,
                  TicketingGateService gateService,
                  QueueConfigurationResolver configResolver,
                  WaitTimeEstimator estimator,
                  Clock clock,
                  int timeoutWarningMinutes,
                  QueueEventListener eventListener,
                  Consumer<GateState> stateListener) {
        this.eventId = eventId;
        this.userSessionId = userSessionId;
        this.gateService = gateService;
        this.configResolver = configResolver;
        this.estimator = estimator;
        this.clock = clock;
        this.timeoutWarningMinutes = timeoutWarningMinutes;
        this.eventListener = eventListener;
        this.stateListener = stateListener;
    }

    public synchronized GateState checkStatus() {
        state = state.withChecking(true);

        QueueConfiguration config;
        GateSnapshot snapshot;
        try {
            config = configResolver.resolve(eventId);
            snapshot = gateService.status(eventId, userSessionId);
        } catch (RuntimeException e) {
            log.warn("Gate status check failed. eventId={}, session={}", eventId, userSessionId, e);
            return publish(GateState.unavailable());
        }

        GateState next;
        if (snapshot.isActive()) {
            next = new GateState(true, null, snapshot.waitingCount(), snapshot.activeCount(), false, 0);
            if (observedWaiting) {
                emit(QueueEvent.promoted(lastPosition));
            }
            observedWaiting = false;
            lastPosition = null;
            lastNotifiedPosition = null;
            checkTimeoutWarning(snapshot, config);
        } else if (snapshot.isWaiting()) {
            int position = snapshot.queuePosition();
            int minutes = estimator.estimate(position, snapshot.activeCount(), config.maxConcurrent());
            next = new GateState(false, position, snapshot.waitingCount(), snapshot.activeCount(), false, minutes);

            if (lastNotifiedPosition == null) {
                lastNotifiedPosition = position;
            } else if (PositionChangePolicy.shouldNotify(lastNotifiedPosition, position)) {
                emit(QueueEvent.positionChanged(lastNotifiedPosition, position));
                lastNotifiedPosition = position;
            }
            observedWaiting = true;
            lastPosition = position;
            warnedCreatedAt = null;
        } else {
            // 세션 없음: 다음 row 는 처음부터 다시 본다
            observedWaiting = false;
            lastPosition = null;
            lastNotifiedPosition = null;
            warnedCreatedAt = null;
            next = new GateState(false, null, snapshot.waitingCount(), snapshot.activeCount(), false, 0);
        }
        return publish(next);
    }

    /**
     * 대기 중이면 입장 재시도. 자기 앞 인원이 빈 자리 안에 들어올 때만 시도한다 (FIFO 유지).
     * 변경 알림 / 폴링이 부르는 진입점.
     */
    public GateState recheck() {
        GateState current = checkStatus();
        if (!current.isWaiting()) {
            return current;
        }
        long freeSlots = (long) configResolver.resolve(eventId).maxConcurrent() - current.activeCount();
        if (freeSlots > 0 && current.queuePosition() <= freeSlots) {
            enterGate();
            return state;
        }
        return current;
    }

    public boolean enterGate() {
        boolean admitted;
        try {
            QueueConfiguration config = configResolver.resolve(eventId);
            admitted = gateService.enter(eventId, userSessionId, config.maxConcurrent());
        } catch (RuntimeException e) {
            log.warn("Gate enter failed. eventId={}, session={}", eventId, userSessionId, e);
            synchronized (this) {
                publish(GateState.unavailable());
            }
            return false;
        }
        checkStatus();
        return admitted;
    }

    public void exitGate() {
        try {
            gateService.exit(eventId, userSessionId);
        } catch (RuntimeException e) {
            // reaper 가 결국 정리한다
            log.warn("Gate exit failed. eventId={}, session={}", eventId, userSessionId, e);
        }
        synchronized (this) {
            observedWaiting = false;
            lastPosition = null;
            lastNotifiedPosition = null;
            warnedCreatedAt = null;
            publish(GateState.unavailable());
        }
    }

    public GateState currentState() {
        return state;
    }

    public UUID eventId() {
        return eventId;
    }

    public String userSessionId() {
        return userSessionId;
    }

    private void checkTimeoutWarning(GateSnapshot snapshot, QueueConfiguration config) {
        if (snapshot.createdAt() == null || snapshot.createdAt().equals(warnedCreatedAt)) {
            return;
        }
        // reaper 는 created_at 기준으로 만료시킨다
        long elapsed = Duration.between(snapshot.createdAt(), LocalDateTime.now(clock)).toMinutes();
        long remaining = config.sessionTimeoutMinutes() - elapsed;
        if (remaining <= timeoutWarningMinutes) {
            warnedCreatedAt = snapshot.createdAt();
            emit(QueueEvent.timeoutWarning((int) Math.max(remaining, 0)));
        }
    }

    private GateState publish(GateState next) {
        state = next;
        try {
            stateListener.accept(next);
        } catch (RuntimeException e) {
            log.warn("Gate state listener failed. eventId={}, session={}", eventId, userSessionId, e);
        }
        return next;
    }

    private void emit(QueueEvent event) {
        try {
            eventListener.onQueueEvent(event);
        } catch (RuntimeException e) {
            log.warn("Queue event listener failed. eventId={}, session={}, type={}",
                    eventId, userSessionId, event.type(), e);
        }
    }
}
