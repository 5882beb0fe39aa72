package com.len.gate.infra.session;

import com.len.gate.domain.notify.SessionChangeFeed;
import com.len.gate.domain.session.DuplicateSessionException;
import com.len.gate.domain.session.SessionStatus;
import com.len.gate.domain.session.TicketingSession;
import com.len.gate.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Testcontainers(disabledWithoutDocker = true)
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaTicketingSessionStore.class, JpaTicketingSessionStoreTest.ClockConfig.class})
@ActiveProfiles("test")
// 유니크 위반/커밋 후 알림을 실제로 보려면 store 가 자기 트랜잭션을 커밋해야 한다
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaTicketingSessionStoreTest {

    @Container
    @ServiceConnection
    static final MySQLContainer<?> mysql =
            new MySQLContainer<>("mysql:8.4")
                    .withDatabaseName("ticketing")
                    .withUsername("test")
                    .withPassword("test");

    static final MutableClock CLOCK = MutableClock.startingAt("2025-03-01T01:00:00Z");

    @TestConfiguration
    static class ClockConfig {
        @Bean
        MutableClock clock() {
            return CLOCK;
        }
    }

    @Autowired
    JpaTicketingSessionStore store;

    @Autowired
    TicketingSessionJpaRepository repository;

    @MockBean
    SessionChangeFeed changeFeed;

    final UUID eventId = UUID.randomUUID();

    @AfterEach
    void tearDown() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("create 후 진행중 세션 조회 + 카운트, 커밋 후 INSERT 알림")
    void create_andFind() {
        store.create(eventId, "session-1-a", SessionStatus.ACTIVE);
        store.create(eventId, "session-2-b", SessionStatus.WAITING);

        TicketingSession a = store.findOpen(eventId, "session-1-a").orElseThrow();
        assertThat(a.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(a.getEnteredAt()).isNotNull();
        assertThat(store.findOpen(eventId, "session-2-b").orElseThrow().getEnteredAt()).isNull();
        assertThat(store.countActive(eventId)).isEqualTo(1);
        assertThat(store.countWaiting(eventId)).isEqualTo(1);
        assertThat(store.countActive(UUID.randomUUID())).isZero();

        verify(changeFeed, times(2)).publish(eventId, "INSERT");
    }

    @Test
    @DisplayName("같은 (이벤트, 세션)의 진행중 row 는 하나만")
    void duplicateOpenSession_rejected() {
        store.create(eventId, "session-1-a", SessionStatus.WAITING);

        assertThatThrownBy(() -> store.create(eventId, "session-1-a", SessionStatus.ACTIVE))
                .isInstanceOf(DuplicateSessionException.class);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("completed 가 된 뒤에는 같은 세션으로 다시 row 를 만들 수 있다")
    void completed_allowsNewRow() {
        store.create(eventId, "session-1-a", SessionStatus.ACTIVE);
        assertThat(store.complete(eventId, "session-1-a")).isEqualTo(1);
        assertThat(store.complete(eventId, "session-1-a")).isZero();

        store.create(eventId, "session-1-a", SessionStatus.ACTIVE);

        assertThat(repository.count()).isEqualTo(2);
        assertThat(store.countActive(eventId)).isEqualTo(1);
    }

    @Test
    @DisplayName("대기 순번은 created_at, 같으면 id 순")
    void waitingAhead_ordersByCreatedAtThenId() {
        TicketingSession first = store.create(eventId, "session-1-a", SessionStatus.WAITING);
        TicketingSession second = store.create(eventId, "session-2-b", SessionStatus.WAITING);
        CLOCK.advance(Duration.ofSeconds(1));
        store.create(eventId, "session-3-c", SessionStatus.WAITING);

        TicketingSession third = store.findOpen(eventId, "session-3-c").orElseThrow();
        TicketingSession secondLoaded = store.findOpen(eventId, "session-2-b").orElseThrow();

        assertThat(store.countWaitingAhead(eventId, secondLoaded.getCreatedAt(), second.getId())).isEqualTo(1);
        assertThat(store.countWaitingAhead(eventId, third.getCreatedAt(), third.getId())).isEqualTo(2);
        assertThat(store.findEarliestWaiting(eventId).orElseThrow().getId()).isEqualTo(first.getId());
    }

    @Test
    @DisplayName("ACTIVE 로 바꾸면 entered_at 기록, completed 는 다시 열 수 없다")
    void updateStatus() {
        TicketingSession waiting = store.create(eventId, "session-1-a", SessionStatus.WAITING);
        CLOCK.advance(Duration.ofSeconds(5));

        assertThat(store.updateStatus(waiting.getId(), SessionStatus.ACTIVE)).isTrue();
        TicketingSession active = store.findOpen(eventId, "session-1-a").orElseThrow();
        assertThat(active.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(active.getEnteredAt()).isEqualTo(LocalDateTime.now(CLOCK));

        assertThat(store.updateStatus(waiting.getId(), SessionStatus.COMPLETED)).isTrue();
        assertThat(store.updateStatus(waiting.getId(), SessionStatus.ACTIVE)).isFalse();
        assertThat(store.findOpen(eventId, "session-1-a")).isEmpty();
        assertThat(store.updateStatus(Long.MAX_VALUE, SessionStatus.ACTIVE)).isFalse();
    }

    @Test
    @DisplayName("cutoff 이전에 만든 진행중 세션만 만료, 알림은 EXPIRE")
    void expireOlderThan() {
        store.create(eventId, "session-1-a", SessionStatus.ACTIVE);
        store.create(eventId, "session-2-b", SessionStatus.WAITING);
        CLOCK.advance(Duration.ofMinutes(10));
        store.create(eventId, "session-3-c", SessionStatus.WAITING);

        int expired = store.expireOlderThan(eventId, LocalDateTime.now(CLOCK).minusMinutes(5));

        assertThat(expired).isEqualTo(2);
        assertThat(store.countActive(eventId)).isZero();
        assertThat(store.countWaiting(eventId)).isEqualTo(1);
        verify(changeFeed).publish(eventId, "EXPIRE");
    }

    @Test
    @DisplayName("진행중 세션이 있는 이벤트만 reaper 대상")
    void eventIdsWithOpenSessions() {
        UUID closedEvent = UUID.randomUUID();
        store.create(eventId, "session-1-a", SessionStatus.ACTIVE);
        store.create(closedEvent, "session-2-b", SessionStatus.ACTIVE);
        store.complete(closedEvent, "session-2-b");

        assertThat(store.findEventIdsWithOpenSessions()).containsExactly(eventId);
    }

    @Test
    @DisplayName("바뀐 row 가 없으면 알림도 없다")
    void noChange_noPublish() {
        assertThat(store.complete(eventId, "session-9-z")).isZero();
        assertThat(store.expireOlderThan(eventId, LocalDateTime.now(CLOCK))).isZero();

        verify(changeFeed, never()).publish(eq(eventId), anyString());
    }
}
