package com.qqsuccubus.triviasync.core.msg;

import lombok.Value;

/**
 * Global lifecycle event of the realtime transport.
 */
@Value
public class ConnectionEvent {

    public enum Kind {
        OPEN,
        CLOSE,
        ERROR
    }

    Kind kind;
    Throwable cause;
    long timestamp;

    public static ConnectionEvent open(long timestamp) {
        return new ConnectionEvent(Kind.OPEN, null, timestamp);
    }

    public static ConnectionEvent close(long timestamp) {
        return new ConnectionEvent(Kind.CLOSE, null, timestamp);
    }

    public static ConnectionEvent error(Throwable cause, long timestamp) {
        return new ConnectionEvent(Kind.ERROR, cause, timestamp);
    }
}
