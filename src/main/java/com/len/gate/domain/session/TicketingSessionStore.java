package com.len.gate.domain.session;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 입장 게이트가 세션 테이블에 접근하는 유일한 경로.
 * 모든 변경(create / update / expire)은 커밋 이후 이벤트 단위 변경 알림을 발행한다.
 */
public interface TicketingSessionStore {

    /**
     * 세션 row 생성
     * @throws DuplicateSessionException 같은 (eventId, userSessionId)의 진행중 row가 이미 있으면
     */
    TicketingSession create(UUID eventId, String userSessionId, SessionStatus status);

    /**
     * completed가 아닌 본인 세션 (없으면 empty)
     */
    Optional<TicketingSession> findOpen(UUID eventId, String userSessionId);

    long countActive(UUID eventId);

    long countWaiting(UUID eventId);

    /**
     * 대기 순번 계산용: (createdAt, id) 기준으로 앞에 있는 waiting row 수
     */
    long countWaitingAhead(UUID eventId, LocalDateTime createdAt, long id);

    /**
     * id 기준 상태 변경. ACTIVE 전환 시 entered_at 기록.
     * @return 변경된 row가 있으면 true
     */
    boolean updateStatus(long id, SessionStatus status);

    /**
     * 본인 세션 종료 (exit)
     * @return 변경된 row 수 (0 또는 1)
     */
    int complete(UUID eventId, String userSessionId);

    Optional<TicketingSession> findEarliestWaiting(UUID eventId);

    /**
     * created_at < cutoff 인 active/waiting row 일괄 completed 처리
     * @return 처리된 row 수
     */
    int expireOlderThan(UUID eventId, LocalDateTime cutoff);

    /**
     * 진행중 세션이 남아있는 이벤트 목록 (reaper 스캔용)
     */
    List<UUID> findEventIdsWithOpenSessions();
}
