package com.len.gate.infra.session;

import com.len.gate.domain.notify.SessionChangeFeed;
import com.len.gate.domain.session.DuplicateSessionException;
import com.len.gate.domain.session.SessionStatus;
import com.len.gate.domain.session.TicketingSession;
import com.len.gate.domain.session.TicketingSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTicketingSessionStore implements TicketingSessionStore {

    private final TicketingSessionJpaRepository repository;
    private final SessionChangeFeed changeFeed;
    private final Clock clock;

    @Override
    @Transactional
    public TicketingSession create(UUID eventId, String userSessionId, SessionStatus status) {
        TicketingSession session = TicketingSession.open(eventId, userSessionId, status, LocalDateTime.now(clock));
        try {
            // flush 해야 유니크 위반이 여기서 터진다
            TicketingSession saved = repository.saveAndFlush(session);
            publishAfterCommit(eventId, "INSERT");
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateSessionException(eventId, userSessionId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TicketingSession> findOpen(UUID eventId, String userSessionId) {
        return repository.findOpen(eventId, userSessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countActive(UUID eventId) {
        return repository.countByEventIdAndStatus(eventId, SessionStatus.ACTIVE);
    }

    @Override
    @Transactional(readOnly = true)
    public long countWaiting(UUID eventId) {
        return repository.countByEventIdAndStatus(eventId, SessionStatus.WAITING);
    }

    @Override
    @Transactional(readOnly = true)
    public long countWaitingAhead(UUID eventId, LocalDateTime createdAt, long id) {
        return repository.countWaitingAhead(eventId, createdAt, id);
    }

    @Override
    @Transactional
    public boolean updateStatus(long id, SessionStatus status) {
        Optional<TicketingSession> found = repository.findById(id);
        if (found.isEmpty()) {
            return false;
        }
        TicketingSession session = found.get();
        if (!session.getStatus().isOpen()) {
            // completed 는 종착 상태
            log.debug("Skip status update on completed session. id={}, requested={}", id, status);
            return false;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        switch (status) {
            case ACTIVE -> session.activate(now);
            case COMPLETED -> session.complete(now);
            case WAITING -> throw new IllegalArgumentException("cannot move a session back to WAITING. id=" + id);
        }
        publishAfterCommit(session.getEventId(), "UPDATE");
        return true;
    }

    @Override
    @Transactional
    public int complete(UUID eventId, String userSessionId) {
        int updated = repository.completeOpen(eventId, userSessionId, LocalDateTime.now(clock));
        if (updated > 0) {
            publishAfterCommit(eventId, "UPDATE");
        }
        return updated;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TicketingSession> findEarliestWaiting(UUID eventId) {
        return repository.findFirstByEventIdAndStatusOrderByCreatedAtAscIdAsc(eventId, SessionStatus.WAITING);
    }

    @Override
    @Transactional
    public int expireOlderThan(UUID eventId, LocalDateTime cutoff) {
        int expired = repository.expireOlderThan(eventId, cutoff, LocalDateTime.now(clock));
        if (expired > 0) {
            publishAfterCommit(eventId, "EXPIRE");
        }
        return expired;
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> findEventIdsWithOpenSessions() {
        return repository.findEventIdsWithOpenSessions();
    }

    /**
     * 커밋 전에 알림을 보내면 구독자가 아직 안 보이는 row 를 다시 읽게 된다.
     * -> afterCommit 에서 발행한다.
     */
    private void publishAfterCommit(UUID eventId, String changeType) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            changeFeed.publish(eventId, changeType);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                changeFeed.publish(eventId, changeType);
            }
        });
    }
}
