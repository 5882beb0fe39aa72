package com.len.gate.domain.session;

import java.util.UUID;

/**
 * 같은 사용자 세션이 동시에 두 번 insert 된 경우 (유니크 제약 위반)
 */
public class DuplicateSessionException extends RuntimeException {

    public DuplicateSessionException(UUID eventId, String userSessionId, Throwable cause) {
        super("open session already exists. eventId=" + eventId + ", userSessionId=" + userSessionId, cause);
    }
}
