package com.len.gate.domain.queue;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 이벤트별 대기열 설정 (관리자가 저장, 게이트는 읽기만)
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(name = "queue_configurations")
public class EventQueueSettings {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, unique = true, columnDefinition = "BINARY(16)")
    private UUID eventId;

    @Column(name = "max_concurrent_users", nullable = false)
    private int maxConcurrentUsers;

    @Column(name = "checkout_timeout_minutes", nullable = false)
    private int checkoutTimeoutMinutes;

    @Column(name = "session_timeout_minutes", nullable = false)
    private int sessionTimeoutMinutes;

    @Column(name = "enable_queue", nullable = false)
    private boolean enableQueue;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static EventQueueSettings of(UUID eventId, int maxConcurrentUsers, int checkoutTimeoutMinutes,
                                        int sessionTimeoutMinutes, boolean enableQueue, LocalDateTime now) {
        EventQueueSettings s = new EventQueueSettings();
        s.eventId = eventId;
        s.maxConcurrentUsers = maxConcurrentUsers;
        s.checkoutTimeoutMinutes = checkoutTimeoutMinutes;
        s.sessionTimeoutMinutes = sessionTimeoutMinutes;
        s.enableQueue = enableQueue;
        s.createdAt = now;
        s.updatedAt = now;
        return s;
    }
}
