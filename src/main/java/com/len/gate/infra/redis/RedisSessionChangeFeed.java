package com.len.gate.infra.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.gate.domain.notify.ChangeSubscription;
import com.len.gate.domain.notify.ChannelState;
import com.len.gate.domain.notify.SessionChangeFeed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.SubscriptionListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Redis pub/sub 기반 세션 변경 알림.
 * 노드가 여러 대여도 같은 이벤트 채널을 구독하면 모두 알림을 받는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisSessionChangeFeed implements SessionChangeFeed {

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer container;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public ChangeSubscription subscribe(UUID eventId, Runnable onChange, Consumer<ChannelState> onState) {
        ChannelTopic topic = new ChannelTopic(GateRedisKeys.changeChannel(eventId));
        EventChannelListener listener = new EventChannelListener(eventId, onChange, onState);

        try {
            container.addMessageListener(listener, topic);
        } catch (RuntimeException e) {
            log.warn("[ChangeFeed] subscribe failed. eventId={}", eventId, e);
            onState.accept(ChannelState.CHANNEL_ERROR);
            return () -> { };
        }

        return () -> {
            if (listener.close()) {
                container.removeMessageListener(listener, topic);
            }
        };
    }

    @Override
    public void publish(UUID eventId, String changeType) {
        try {
            String payload = objectMapper.writeValueAsString(
                    new SessionChangeMessage(eventId.toString(), changeType, clock.millis()));
            redis.convertAndSend(GateRedisKeys.changeChannel(eventId), payload);
        } catch (JsonProcessingException e) {
            log.error("[ChangeFeed] serialize failed. eventId={}, type={}", eventId, changeType, e);
        } catch (RuntimeException e) {
            // 알림 유실은 폴링/reaper 가 메운다
            log.warn("[ChangeFeed] publish failed. eventId={}, type={}", eventId, changeType, e);
        }
    }

    private static final class EventChannelListener implements MessageListener, SubscriptionListener {

        private final UUID eventId;
        private final Runnable onChange;
        private final Consumer<ChannelState> onState;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private EventChannelListener(UUID eventId, Runnable onChange, Consumer<ChannelState> onState) {
            this.eventId = eventId;
            this.onChange = onChange;
            this.onState = onState;
        }

        @Override
        public void onMessage(Message message, byte[] pattern) {
            if (closed.get()) return;
            try {
                onChange.run();
            } catch (RuntimeException e) {
                log.warn("[ChangeFeed] change handler failed. eventId={}", eventId, e);
            }
        }

        @Override
        public void onChannelSubscribed(byte[] channel, long count) {
            if (!closed.get()) {
                onState.accept(ChannelState.SUBSCRIBED);
            }
        }

        @Override
        public void onChannelUnsubscribed(byte[] channel, long count) {
            // 우리가 닫은 게 아니면 연결이 끊긴 것
            if (!closed.get()) {
                onState.accept(ChannelState.CLOSED);
            }
        }

        boolean close() {
            return closed.compareAndSet(false, true);
        }
    }
}
