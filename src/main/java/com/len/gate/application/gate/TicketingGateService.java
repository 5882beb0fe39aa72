package com.len.gate.application.gate;

import com.len.gate.domain.session.DuplicateSessionException;
import com.len.gate.domain.session.SessionStatus;
import com.len.gate.domain.session.TicketingSession;
import com.len.gate.domain.session.TicketingSessionStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * 입장 게이트 공용 로직 (상태 없음).
 * store 예외는 그대로 던진다. 호출자별 복구는 AdmissionGate 가 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketingGateService {

    private final TicketingSessionStore sessionStore;
    private final AdmissionLock admissionLock;
    private final MeterRegistry meterRegistry;

    public GateSnapshot status(UUID eventId, String userSessionId) {
        Optional<TicketingSession> own = sessionStore.findOpen(eventId, userSessionId);
        long activeCount = sessionStore.countActive(eventId);
        long waitingCount = sessionStore.countWaiting(eventId);

        if (own.isEmpty()) {
            return GateSnapshot.noSession(activeCount, waitingCount);
        }

        TicketingSession s = own.get();
        Integer position = null;
        if (s.isWaiting()) {
            // 순번은 저장하지 않고 매번 계산 (created_at, id 순)
            position = (int) (1 + sessionStore.countWaitingAhead(eventId, s.getCreatedAt(), s.getId()));
        }
        return new GateSnapshot(s.getStatus(), s.getCreatedAt(), s.getEnteredAt(), position, activeCount, waitingCount);
    }

    /**
     * @return 입장(active) 상태면 true, 대기면 false
     */
    public boolean enter(UUID eventId, String userSessionId, int maxConcurrent) {
        EnterResult result = admissionLock.executeWithLock(eventId,
                () -> decideEntry(eventId, userSessionId, maxConcurrent));

        meterRegistry.counter("ticketing.gate.enter", "result", result.metricTag()).increment();
        if (result == EnterResult.ADMITTED || result == EnterResult.PROMOTED) {
            log.debug("Admitted. eventId={}, session={}, result={}", eventId, userSessionId, result);
        }
        return result.admitted();
    }

    /**
     * 본인 세션 종료 + 가장 먼저 온 대기자 1명 승격 (용량 재확인 없음).
     * 본인 row 종료는 락 밖에서 바로 한다. 락은 승격(hand-off)에만 건다.
     * 대기 중이던 세션이 나가는 경우는 빈 자리가 생기지 않으므로 승격하지 않는다.
     */
    public ExitResult exit(UUID eventId, String userSessionId) {
        Optional<TicketingSession> own = sessionStore.findOpen(eventId, userSessionId);
        boolean wasActive = own.map(TicketingSession::isActive).orElse(false);

        int completed = sessionStore.complete(eventId, userSessionId);
        ExitResult result;
        if (completed == 0 || !wasActive) {
            result = new ExitResult(completed > 0, null);
        } else {
            result = new ExitResult(true, handOff(eventId, userSessionId));
        }

        meterRegistry.counter("ticketing.gate.exit",
                "handoff", String.valueOf(result.promotedSessionId() != null)).increment();
        if (result.promotedSessionId() != null) {
            log.info("Exit hand-off. eventId={}, exited={}, promoted={}",
                    eventId, userSessionId, result.promotedSessionId());
        }
        return result;
    }

    private String handOff(UUID eventId, String exitedSessionId) {
        try {
            return admissionLock.executeWithLock(eventId, () -> {
                Optional<TicketingSession> next = sessionStore.findEarliestWaiting(eventId);
                if (next.isPresent() && sessionStore.updateStatus(next.get().getId(), SessionStatus.ACTIVE)) {
                    return next.get().getUserSessionId();
                }
                return null;
            });
        } catch (AdmissionLockException e) {
            // 빈 자리는 이미 생겼다. 맨 앞 대기자가 recheck 에서 스스로 입장한다
            log.warn("Exit hand-off skipped, admission lock busy. eventId={}, exited={}", eventId, exitedSessionId);
            return null;
        }
    }

    private EnterResult decideEntry(UUID eventId, String userSessionId, int maxConcurrent) {
        Optional<TicketingSession> own = sessionStore.findOpen(eventId, userSessionId);

        if (own.isPresent()) {
            TicketingSession s = own.get();
            if (s.isActive()) {
                return EnterResult.ALREADY_ACTIVE;
            }
            if (sessionStore.countActive(eventId) < maxConcurrent
                    && sessionStore.updateStatus(s.getId(), SessionStatus.ACTIVE)) {
                return EnterResult.PROMOTED;
            }
            return EnterResult.WAITING;
        }

        SessionStatus status = sessionStore.countActive(eventId) < maxConcurrent
                ? SessionStatus.ACTIVE
                : SessionStatus.WAITING;
        try {
            sessionStore.create(eventId, userSessionId, status);
        } catch (DuplicateSessionException e) {
            // 같은 세션의 동시 요청이 먼저 insert 함 → 그 row 기준으로 응답
            log.info("Duplicate session insert, reusing existing row. eventId={}, session={}", eventId, userSessionId);
            return sessionStore.findOpen(eventId, userSessionId)
                    .map(existing -> existing.isActive() ? EnterResult.ALREADY_ACTIVE : EnterResult.WAITING)
                    .orElse(EnterResult.WAITING);
        }
        return status == SessionStatus.ACTIVE ? EnterResult.ADMITTED : EnterResult.QUEUED;
    }

    public record ExitResult(boolean completed, String promotedSessionId) {}

    private enum EnterResult {
        ADMITTED(true, "admitted"),
        PROMOTED(true, "promoted"),
        ALREADY_ACTIVE(true, "already_active"),
        QUEUED(false, "queued"),
        WAITING(false, "waiting");

        private final boolean admitted;
        private final String metricTag;

        EnterResult(boolean admitted, String metricTag) {
            this.admitted = admitted;
            this.metricTag = metricTag;
        }

        boolean admitted() {
            return admitted;
        }

        String metricTag() {
            return metricTag;
        }
    }
}
