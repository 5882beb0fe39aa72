package com.len.gate.application.gate;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 페이지 이탈(beacon) 시 exit. 결과를 기다리지 않는다.
 * 실패해도 reaper 가 세션 타임아웃 후 정리한다.
 */
@Slf4j
@Component
public class BestEffortExitDispatcher {

    private final TicketingGateService gateService;
    private final TaskExecutor executor;

    public BestEffortExitDispatcher(TicketingGateService gateService,
                                    @Qualifier("gateExitExecutor") TaskExecutor executor) {
        this.gateService = gateService;
        this.executor = executor;
    }

    public void dispatch(UUID eventId, String userSessionId) {
        try {
            executor.execute(() -> {
                try {
                    gateService.exit(eventId, userSessionId);
                } catch (RuntimeException e) {
                    log.warn("Best-effort exit failed. eventId={}, session={}", eventId, userSessionId, e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Best-effort exit rejected (executor saturated). eventId={}, session={}", eventId, userSessionId);
        }
    }
}
