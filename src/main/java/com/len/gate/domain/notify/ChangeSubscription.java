package com.len.gate.domain.notify;

/**
 * 변경 구독 핸들. close()는 여러 번 호출해도 안전해야 한다.
 */
@FunctionalInterface
public interface ChangeSubscription extends AutoCloseable {

    @Override
    void close();
}
