package com.len.gate.infra.queue;

import com.len.gate.domain.queue.EventQueueSettings;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface EventQueueSettingsJpaRepository extends JpaRepository<EventQueueSettings, Long> {

    Optional<EventQueueSettings> findByEventId(UUID eventId);
}
