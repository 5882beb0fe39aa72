package com.len.gate.api.gate.dto;

import java.util.UUID;

public record CleanupResponse(UUID eventId, int expired) {}
