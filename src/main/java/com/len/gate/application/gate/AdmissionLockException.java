package com.len.gate.application.gate;

import java.util.UUID;

public class AdmissionLockException extends RuntimeException {

    public AdmissionLockException(UUID eventId, int attempts) {
        super("failed to acquire admission lock. eventId=" + eventId + ", attempts=" + attempts);
    }

    public AdmissionLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
