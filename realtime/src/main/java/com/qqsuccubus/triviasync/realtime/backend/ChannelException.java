package com.qqsuccubus.triviasync.realtime.backend;

import lombok.Getter;

/**
 * Transport-level failure of a channel operation.
 */
@Getter
public class ChannelException extends RuntimeException {

    public enum Status {
        CHANNEL_ERROR,
        TIMED_OUT,
        CLOSED
    }

    private final String channel;
    private final Status status;

    public ChannelException(String channel, Status status, String message) {
        super(message);
        this.channel = channel;
        this.status = status;
    }

    public ChannelException(String channel, Status status, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
        this.status = status;
    }
}
