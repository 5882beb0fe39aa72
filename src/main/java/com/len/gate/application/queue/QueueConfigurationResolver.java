package com.len.gate.application.queue;

import com.len.gate.domain.queue.EventQueueSettings;
import com.len.gate.infra.config.GateProperties;
import com.len.gate.infra.queue.EventQueueSettingsJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * queue_configurations 조회 + 이벤트별 캐시 (무효화 없음).
 * 조회 실패 시 기본값을 주되 캐시하지 않는다 (다음 호출에서 재조회).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueConfigurationResolver {

    private final EventQueueSettingsJpaRepository repository;
    private final GateProperties properties;

    private final Map<UUID, QueueConfiguration> cache = new ConcurrentHashMap<>();

    public QueueConfiguration resolve(UUID eventId) {
        QueueConfiguration cached = cache.get(eventId);
        if (cached != null) {
            return cached;
        }

        Optional<EventQueueSettings> found;
        try {
            found = repository.findByEventId(eventId);
        } catch (DataAccessException e) {
            log.warn("Queue configuration lookup failed, using defaults. eventId={}", eventId, e);
            return defaults();
        }

        QueueConfiguration resolved = found.map(this::toConfiguration).orElseGet(this::defaults);
        QueueConfiguration prev = cache.putIfAbsent(eventId, resolved);
        return prev != null ? prev : resolved;
    }

    public QueueConfiguration defaults() {
        return new QueueConfiguration(
                properties.defaultMaxConcurrent(),
                properties.defaultSessionTimeoutMinutes(),
                properties.defaultCheckoutTimeoutMinutes(),
                true
        );
    }

    private QueueConfiguration toConfiguration(EventQueueSettings s) {
        int maxConcurrent = s.isEnableQueue() ? s.getMaxConcurrentUsers() : Integer.MAX_VALUE;
        return new QueueConfiguration(
                maxConcurrent,
                s.getSessionTimeoutMinutes(),
                s.getCheckoutTimeoutMinutes(),
                s.isEnableQueue()
        );
    }
}
