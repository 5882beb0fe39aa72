package com.len.gate.infra.sse;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class GateSsePingScheduler {

    private final GateSseHub hub;

    @Scheduled(fixedRateString = "${ticketing.gate.stream.ping-interval-ms:15000}")
    public void ping() {
        hub.pingAll();
    }

    @Scheduled(fixedDelayString = "${ticketing.gate.stream.refresh-interval-ms:30000}")
    public void refreshAdmitted() {
        hub.refreshAdmitted();
    }
}
