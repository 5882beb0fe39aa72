package com.len.gate.application.gate;

import com.len.gate.domain.notify.ChangeSubscription;
import com.len.gate.domain.notify.ChannelState;
import com.len.gate.domain.notify.SessionChangeFeed;
import com.len.gate.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChangeNotificationBridgeTest {

    static final Duration POLL = Duration.ofSeconds(3);
    static final Duration SUBSCRIBE_TIMEOUT = Duration.ofSeconds(10);

    @Mock SessionChangeFeed changeFeed;
    @Mock TaskScheduler scheduler;
    @Mock ChangeSubscription subscription;
    @Mock ScheduledFuture<Object> timeoutFuture;
    @Mock ScheduledFuture<Object> pollFuture;
    @Mock ScheduledFuture<Object> recheckFuture;

    final UUID eventId = UUID.randomUUID();
    final MutableClock clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
    final AtomicInteger rechecks = new AtomicInteger();

    ChangeNotificationBridge bridge;
    Runnable onChange;
    Consumer<ChannelState> onState;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        doReturn(subscription).when(changeFeed).subscribe(eq(eventId), any(Runnable.class), any(Consumer.class));
        doReturn(timeoutFuture).when(scheduler)
                .schedule(any(Runnable.class), eq(clock.instant().plus(SUBSCRIBE_TIMEOUT)));
        doReturn(recheckFuture).when(scheduler).schedule(any(Runnable.class), eq(clock.instant()));
        doReturn(pollFuture).when(scheduler)
                .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(POLL));

        bridge = new ChangeNotificationBridge(eventId, changeFeed, scheduler, clock, POLL, SUBSCRIBE_TIMEOUT,
                rechecks::incrementAndGet);
        bridge.start();

        ArgumentCaptor<Runnable> changeCaptor = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Consumer<ChannelState>> stateCaptor = ArgumentCaptor.forClass(Consumer.class);
        verify(changeFeed).subscribe(eq(eventId), changeCaptor.capture(), stateCaptor.capture());
        onChange = changeCaptor.getValue();
        onState = stateCaptor.getValue();
    }

    @Test
    @DisplayName("구독 확인이 오면 push 모드, 타임아웃 타이머 취소, 폴링 없음")
    void subscribed_pushOnly() {
        onState.accept(ChannelState.SUBSCRIBED);

        assertThat(bridge.mode()).isEqualTo(ChangeNotificationBridge.Mode.PUSH);
        verify(timeoutFuture).cancel(false);
        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    @DisplayName("변경 알림은 스케줄러에서 recheck 로 이어지고, 몰리면 하나로 합쳐진다")
    void change_triggersCoalescedRecheck() {
        onState.accept(ChannelState.SUBSCRIBED);

        onChange.run();
        onChange.run();

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, times(1)).schedule(task.capture(), eq(clock.instant()));
        task.getValue().run();
        assertThat(rechecks.get()).isEqualTo(1);

        // 처리 후 다시 알림이 오면 새로 예약
        onChange.run();
        verify(scheduler, times(2)).schedule(any(Runnable.class), eq(clock.instant()));
    }

    @Test
    @DisplayName("채널 오류 시 고정 간격 폴링으로 전환")
    void channelError_fallsBackToPolling() {
        onState.accept(ChannelState.CHANNEL_ERROR);

        assertThat(bridge.mode()).isEqualTo(ChangeNotificationBridge.Mode.POLLING);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(task.capture(), eq(clock.instant().plus(POLL)), eq(POLL));

        task.getValue().run();
        task.getValue().run();
        assertThat(rechecks.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("구독 확인 없이 타임아웃되면 폴링")
    void subscribeTimeout_fallsBackToPolling() {
        ArgumentCaptor<Runnable> timeoutTask = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timeoutTask.capture(), eq(clock.instant().plus(SUBSCRIBE_TIMEOUT)));

        timeoutTask.getValue().run();

        assertThat(bridge.mode()).isEqualTo(ChangeNotificationBridge.Mode.POLLING);
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(POLL));
    }

    @Test
    @DisplayName("이미 구독된 뒤의 늦은 타임아웃은 무시")
    void lateTimeout_afterSubscribed_isIgnored() {
        onState.accept(ChannelState.SUBSCRIBED);
        onState.accept(ChannelState.TIMED_OUT);

        assertThat(bridge.mode()).isEqualTo(ChangeNotificationBridge.Mode.PUSH);
        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    @DisplayName("구독 중 연결이 끊기면 폴링, 여러 번 와도 폴링 타이머는 하나")
    void closed_afterSubscribed_pollsOnce() {
        onState.accept(ChannelState.SUBSCRIBED);
        onState.accept(ChannelState.CLOSED);
        onState.accept(ChannelState.CHANNEL_ERROR);

        assertThat(bridge.mode()).isEqualTo(ChangeNotificationBridge.Mode.POLLING);
        verify(scheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(POLL));
    }

    @Test
    @DisplayName("stop 은 타이머 취소 + 구독 해제, 여러 번 불러도 한 번만")
    void stop_isIdempotent() {
        onState.accept(ChannelState.CHANNEL_ERROR);

        bridge.stop();
        bridge.stop();

        assertThat(bridge.mode()).isEqualTo(ChangeNotificationBridge.Mode.STOPPED);
        verify(pollFuture).cancel(false);
        verify(subscription, times(1)).close();
    }

    @Test
    @DisplayName("stop 이후의 알림/상태 변화는 무시")
    void afterStop_nothingRuns() {
        bridge.stop();

        onChange.run();
        onState.accept(ChannelState.CHANNEL_ERROR);

        verify(scheduler, never()).schedule(any(Runnable.class), eq(clock.instant()));
        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        assertThat(rechecks.get()).isZero();
    }

    @Test
    @DisplayName("recheck 예외는 폴링을 멈추지 않는다")
    void recheckFailure_isContained() {
        ChangeNotificationBridge failing = new ChangeNotificationBridge(eventId, changeFeed, scheduler, clock,
                POLL, SUBSCRIBE_TIMEOUT, () -> { throw new IllegalStateException("db down"); });
        failing.start();
        failing.onChannelState(ChannelState.CHANNEL_ERROR);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(task.capture(), any(Instant.class), eq(POLL));
        task.getValue().run();

        assertThat(failing.mode()).isEqualTo(ChangeNotificationBridge.Mode.POLLING);
    }
}
