package com.len.gate.domain.session;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "ticketing_sessions",
        uniqueConstraints = @UniqueConstraint(
                name = "ux_ticketing_session_open",
                columnNames = {"event_id", "user_session_id", "open_flag"}),
        indexes = {
                @Index(name = "idx_ticketing_sessions_event_status", columnList = "event_id,status,created_at"),
                @Index(name = "idx_ticketing_sessions_created_at", columnList = "created_at")
        }
)
public class TicketingSession {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, columnDefinition = "BINARY(16)")
    private UUID eventId;

    @Column(name = "user_session_id", nullable = false, length = 64)
    private String userSessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SessionStatus status;

    // 1=진행중(active/waiting), NULL=completed. (event_id, user_session_id, open_flag) 유니크
    @Column(name = "open_flag")
    private Integer openFlag;

    @Column(name = "created_at", nullable = false, updatable = false, columnDefinition = "DATETIME(6)")
    private LocalDateTime createdAt;

    @Column(name = "entered_at", columnDefinition = "DATETIME(6)")
    private LocalDateTime enteredAt;

    @Column(name = "updated_at", nullable = false, columnDefinition = "DATETIME(6)")
    private LocalDateTime updatedAt;

    public static TicketingSession open(UUID eventId, String userSessionId,
                                        SessionStatus status, LocalDateTime now) {
        if (status == null || !status.isOpen()) {
            throw new IllegalArgumentException("new session must be ACTIVE or WAITING: " + status);
        }
        TicketingSession s = new TicketingSession();
        s.eventId = eventId;
        s.userSessionId = userSessionId;
        s.status = status;
        s.openFlag = 1;
        s.createdAt = now;
        s.enteredAt = status == SessionStatus.ACTIVE ? now : null;
        s.updatedAt = now;
        return s;
    }

    public void activate(LocalDateTime now) {
        if (status == SessionStatus.COMPLETED) {
            throw new IllegalStateException("completed session cannot be reopened. id=" + id);
        }
        this.status = SessionStatus.ACTIVE;
        if (this.enteredAt == null) {
            this.enteredAt = now;
        }
        this.updatedAt = now;
    }

    public void complete(LocalDateTime now) {
        this.status = SessionStatus.COMPLETED;
        this.openFlag = null;
        this.updatedAt = now;
    }

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public boolean isWaiting() {
        return status == SessionStatus.WAITING;
    }
}
