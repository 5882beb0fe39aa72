package com.len.gate.domain.notify;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * 이벤트 단위 세션 테이블 변경 알림.
 * payload는 보지 않는다 (insert/update/delete 구분 없이 "뭔가 바뀌었다"만 전달).
 */
public interface SessionChangeFeed {

    ChangeSubscription subscribe(UUID eventId, Runnable onChange, Consumer<ChannelState> onState);

    void publish(UUID eventId, String changeType);
}
