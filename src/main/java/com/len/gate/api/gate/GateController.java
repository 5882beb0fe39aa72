package com.len.gate.api.gate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.gate.api.gate.dto.CleanupResponse;
import com.len.gate.api.gate.dto.GateRequest;
import com.len.gate.api.gate.dto.GateStatusResponse;
import com.len.gate.application.gate.AdmissionGate;
import com.len.gate.application.gate.AdmissionGateFactory;
import com.len.gate.application.gate.BestEffortExitDispatcher;
import com.len.gate.application.reaper.StaleSessionReaper;
import com.len.gate.common.exception.BusinessException;
import com.len.gate.common.exception.ErrorCode;
import com.len.gate.infra.redis.RedisGateRateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;
import java.util.regex.Pattern;

@Slf4j
@RestController
@RequestMapping("/api/events/{eventId}/gate")
@RequiredArgsConstructor
public class GateController {

    private static final Pattern SESSION_ID = Pattern.compile(GateRequest.SESSION_ID_REGEX);

    private final AdmissionGateFactory gateFactory;
    private final BestEffortExitDispatcher exitDispatcher;
    private final StaleSessionReaper reaper;
    private final RedisGateRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    @PostMapping("/enter")
    public GateStatusResponse enter(@PathVariable UUID eventId, @Valid @RequestBody GateRequest request) {
        checkRate(request.sessionId());
        AdmissionGate gate = gateFactory.create(eventId, request.sessionId());
        gate.enterGate();
        return GateStatusResponse.from(gate.currentState());
    }

    @GetMapping("/status")
    public GateStatusResponse status(@PathVariable UUID eventId, @RequestParam String sessionId) {
        checkSessionId(sessionId);
        checkRate(sessionId);
        return GateStatusResponse.from(gateFactory.create(eventId, sessionId).checkStatus());
    }

    @PostMapping("/exit")
    public GateStatusResponse exit(@PathVariable UUID eventId, @Valid @RequestBody GateRequest request) {
        checkRate(request.sessionId());
        AdmissionGate gate = gateFactory.create(eventId, request.sessionId());
        gate.exitGate();
        return GateStatusResponse.from(gate.currentState());
    }

    /**
     * 페이지 이탈 시 navigator.sendBeacon 용. 본문이 text/plain 으로 올 수 있다.
     * 처리 결과를 기다리지 않고 202.
     */
    @PostMapping(value = "/leave", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Void> leave(@PathVariable UUID eventId, @RequestBody String body) {
        GateRequest request;
        try {
            request = objectMapper.readValue(body, GateRequest.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "leave 요청 본문을 읽을 수 없습니다.");
        }
        checkSessionId(request.sessionId());
        exitDispatcher.dispatch(eventId, request.sessionId());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/cleanup")
    public CleanupResponse cleanup(@PathVariable UUID eventId, @Valid @RequestBody GateRequest request) {
        checkRate(request.sessionId());
        int expired = reaper.sweep(eventId);
        return new CleanupResponse(eventId, expired);
    }

    private void checkSessionId(String sessionId) {
        if (sessionId == null || !SESSION_ID.matcher(sessionId).matches()) {
            throw new BusinessException(ErrorCode.INVALID_SESSION_ID);
        }
    }

    private void checkRate(String sessionId) {
        if (!rateLimiter.tryAcquire(sessionId)) {
            log.warn("Rate limited session: {}", sessionId);
            throw new BusinessException(ErrorCode.RATE_LIMITED);
        }
    }
}
