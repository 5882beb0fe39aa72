package com.len.gate.infra.session;

import com.len.gate.domain.session.SessionStatus;
import com.len.gate.domain.session.TicketingSession;
import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TicketingSessionJpaRepository extends JpaRepository<TicketingSession, Long> {

    // 본인 진행중 세션 (open_flag 유니크라 최대 1건)
    @Query("""
        select s from TicketingSession s
        where s.eventId = :eventId
          and s.userSessionId = :userSessionId
          and s.openFlag = 1
    """)
    Optional<TicketingSession> findOpen(@Param("eventId") UUID eventId,
                                        @Param("userSessionId") String userSessionId);

    long countByEventIdAndStatus(UUID eventId, SessionStatus status);

    // 대기 순번: created_at 이 같으면 id 로 순서를 정한다
    @Query("""
        select count(s) from TicketingSession s
        where s.eventId = :eventId
          and s.status = com.len.gate.domain.session.SessionStatus.WAITING
          and (s.createdAt < :createdAt or (s.createdAt = :createdAt and s.id < :id))
    """)
    long countWaitingAhead(@Param("eventId") UUID eventId,
                           @Param("createdAt") LocalDateTime createdAt,
                           @Param("id") long id);

    Optional<TicketingSession> findFirstByEventIdAndStatusOrderByCreatedAtAscIdAsc(UUID eventId, SessionStatus status);

    @Modifying
    @Query("""
        update TicketingSession s
           set s.status = com.len.gate.domain.session.SessionStatus.COMPLETED,
               s.openFlag = null,
               s.updatedAt = :now
         where s.eventId = :eventId
           and s.userSessionId = :userSessionId
           and s.openFlag = 1
    """)
    int completeOpen(@Param("eventId") UUID eventId,
                     @Param("userSessionId") String userSessionId,
                     @Param("now") LocalDateTime now);

    // 만료 일괄 처리
    @Modifying
    @Query("""
        update TicketingSession s
           set s.status = com.len.gate.domain.session.SessionStatus.COMPLETED,
               s.openFlag = null,
               s.updatedAt = :now
         where s.eventId = :eventId
           and s.openFlag = 1
           and s.createdAt < :cutoff
    """)
    int expireOlderThan(@Param("eventId") UUID eventId,
                        @Param("cutoff") LocalDateTime cutoff,
                        @Param("now") LocalDateTime now);

    @Query("select distinct s.eventId from TicketingSession s where s.openFlag = 1")
    List<UUID> findEventIdsWithOpenSessions();
}
