package com.len.gate.application.gate;

import com.len.gate.domain.notify.ChangeSubscription;
import com.len.gate.domain.notify.ChannelState;
import com.len.gate.domain.notify.SessionChangeFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 변경 알림 → recheck 연결.
 * 구독 확인(SUBSCRIBED)이 오면 push 만, 오류/타임아웃/끊김이면 고정 간격 폴링으로 전환.
 * 한 번 폴링으로 넘어가면 stop() 까지 유지한다.
 */
@Slf4j
public class ChangeNotificationBridge {

    public enum Mode { CONNECTING, PUSH, POLLING, STOPPED }

    private final UUID eventId;
    private final SessionChangeFeed changeFeed;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration pollInterval;
    private final Duration subscribeTimeout;
    private final Runnable recheck;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean recheckPending = new AtomicBoolean(false);

    private volatile Mode mode = Mode.CONNECTING;
    private volatile ChangeSubscription subscription;
    private volatile ScheduledFuture<?> subscribeTimeoutFuture;
    private volatile ScheduledFuture<?> pollFuture;

    ChangeNotificationBridge(UUID eventId, SessionChangeFeed changeFeed, TaskScheduler scheduler, Clock clock,
                             Duration pollInterval, Duration subscribeTimeout, Runnable recheck) {
        this.eventId = eventId;
        this.changeFeed = changeFeed;
        this.scheduler = scheduler;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.subscribeTimeout = subscribeTimeout;
        this.recheck = recheck;
    }

    public void start() {
        if (!started.compareAndSet(false, true) || stopped.get()) {
            return;
        }
        subscribeTimeoutFuture = scheduler.schedule(
                () -> onChannelState(ChannelState.TIMED_OUT),
                clock.instant().plus(subscribeTimeout));

        ChangeSubscription sub = changeFeed.subscribe(eventId, this::onChange, this::onChannelState);
        subscription = sub;
        // subscribe 도중 stop() 된 경우
        if (stopped.get()) {
            sub.close();
        }
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        mode = Mode.STOPPED;
        cancel(subscribeTimeoutFuture);
        cancel(pollFuture);
        ChangeSubscription sub = subscription;
        if (sub != null) {
            sub.close();
        }
    }

    public Mode mode() {
        return mode;
    }

    void onChannelState(ChannelState channelState) {
        if (stopped.get()) {
            return;
        }
        switch (channelState) {
            case SUBSCRIBED -> {
                cancel(subscribeTimeoutFuture);
                if (mode == Mode.CONNECTING) {
                    mode = Mode.PUSH;
                    log.debug("Change feed subscribed. eventId={}", eventId);
                }
            }
            case CHANNEL_ERROR, TIMED_OUT, CLOSED -> {
                if (channelState == ChannelState.TIMED_OUT && mode != Mode.CONNECTING) {
                    return;
                }
                log.warn("Change feed unavailable ({}), falling back to polling every {}. eventId={}",
                        channelState, pollInterval, eventId);
                startPolling();
            }
        }
    }

    private synchronized void startPolling() {
        if (stopped.get() || pollFuture != null) {
            return;
        }
        cancel(subscribeTimeoutFuture);
        mode = Mode.POLLING;
        pollFuture = scheduler.scheduleWithFixedDelay(this::runRecheck,
                clock.instant().plus(pollInterval), pollInterval);
    }

    private void onChange() {
        if (stopped.get()) {
            return;
        }
        // 알림 폭주 시 대기 중인 recheck 하나로 합친다. 리스너 스레드에서 DB 를 읽지 않는다.
        if (recheckPending.compareAndSet(false, true)) {
            scheduler.schedule(() -> {
                recheckPending.set(false);
                runRecheck();
            }, clock.instant());
        }
    }

    private void runRecheck() {
        if (stopped.get()) {
            return;
        }
        try {
            recheck.run();
        } catch (RuntimeException e) {
            log.warn("Recheck failed. eventId={}", eventId, e);
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}
