package com.len.gate.application.gate;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * 이벤트 단위 입장 판정 직렬화.
 * count → insert/promote 사이에 다른 입장 판정이 끼어들지 못하게 한다.
 */
public interface AdmissionLock {

    /**
     * @throws AdmissionLockException 재시도 한도 안에 락을 못 잡으면
     */
    <T> T executeWithLock(UUID eventId, Supplier<T> action);

    String name();
}
