package com.len.gate.application.gate;

@FunctionalInterface
public interface QueueEventListener {

    QueueEventListener NONE = event -> { };

    void onQueueEvent(QueueEvent event);
}
