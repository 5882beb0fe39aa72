package com.len.gate.api.common;

import com.len.gate.common.exception.BusinessException;
import com.len.gate.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException e, HttpServletRequest req) {
        ErrorCode ec = e.getErrorCode();
        log.warn("[{}] {} {} - {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e.getMessage());
        return respond(ec, e.getMessage(), req);
    }

    // ===== 요청 본문 검증 (sessionId 형식 등) =====
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e, HttpServletRequest req) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        ErrorCode ec = fieldError != null && "sessionId".equals(fieldError.getField())
                ? ErrorCode.INVALID_SESSION_ID
                : ErrorCode.INVALID_REQUEST;
        return respond(ec, ec.getMessage(), req);
    }

    // ===== path/query 타입 불일치 (eventId 가 UUID 가 아님 등) =====
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e, HttpServletRequest req) {
        ErrorCode ec = "eventId".equals(e.getName()) ? ErrorCode.INVALID_EVENT_ID : ErrorCode.INVALID_REQUEST;
        return respond(ec, ec.getMessage(), req);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest req) {
        return respond(ErrorCode.INVALID_REQUEST, ErrorCode.INVALID_REQUEST.getMessage(), req);
    }

    // ===== DB 관련 예외 =====
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e, HttpServletRequest req) {
        log.error("[DB_ERROR] {} {}", req.getMethod(), req.getRequestURI(), e);
        return respond(ErrorCode.DB_ERROR, ErrorCode.DB_ERROR.getMessage(), req);
    }

    // ===== 그 외 모든 예외 =====
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAny(Exception e, HttpServletRequest req) {
        log.error("[INTERNAL_ERROR] {} {}", req.getMethod(), req.getRequestURI(), e);
        return respond(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage(), req);
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode ec, String message, HttpServletRequest req) {
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, message, req.getRequestURI()));
    }
}
