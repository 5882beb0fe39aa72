package com.len.gate.api.gate.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record GateRequest(
        @NotBlank
        @Pattern(regexp = GateRequest.SESSION_ID_REGEX, message = "세션 ID 형식이 올바르지 않습니다.")
        String sessionId
) {
    // 클라이언트가 만드는 형식: session-{epochMillis}-{random}
    public static final String SESSION_ID_REGEX = "^session-\\d+-[a-z0-9]+$";
}
