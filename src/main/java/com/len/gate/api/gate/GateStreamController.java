package com.len.gate.api.gate;

import com.len.gate.api.gate.dto.GateRequest;
import com.len.gate.common.exception.BusinessException;
import com.len.gate.common.exception.ErrorCode;
import com.len.gate.infra.sse.GateSseHub;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/events/{eventId}/gate")
public class GateStreamController {

    private final GateSseHub hub;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable UUID eventId, @RequestParam String sessionId) {
        if (!sessionId.matches(GateRequest.SESSION_ID_REGEX)) {
            throw new BusinessException(ErrorCode.INVALID_SESSION_ID);
        }
        return hub.subscribe(eventId, sessionId);
    }
}
