package com.len.gate.infra.redis;

public record SessionChangeMessage(
        String eventId,
        String type,          // "INSERT" / "UPDATE" / "EXPIRE"
        long occurredAtMs
) {}
