package com.len.gate.domain.session;

public enum SessionStatus {
    ACTIVE,
    WAITING,
    COMPLETED;

    public boolean isOpen() {
        return this != COMPLETED;
    }
}
