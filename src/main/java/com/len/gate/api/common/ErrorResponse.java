package com.len.gate.api.common;

import com.len.gate.common.exception.ErrorCode;

import java.time.LocalDateTime;

public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String code,
        String message,
        String path
) {
    public static ErrorResponse of(ErrorCode ec, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), ec.getHttpStatus().value(), ec.getCode(), message, path);
    }
}
