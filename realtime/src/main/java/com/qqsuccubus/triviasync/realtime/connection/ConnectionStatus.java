package com.qqsuccubus.triviasync.realtime.connection;

public enum ConnectionStatus {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTING,
    /**
     * Reconnect attempts exhausted; only {@link ConnectionMonitor#retry()} leaves this state.
     */
    ERROR
}
