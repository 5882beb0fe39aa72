package com.len.gate.domain.notify;

public enum ChannelState {
    SUBSCRIBED,
    CHANNEL_ERROR,
    TIMED_OUT,
    CLOSED
}
