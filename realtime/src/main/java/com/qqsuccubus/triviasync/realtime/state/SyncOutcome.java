package com.qqsuccubus.triviasync.realtime.state;

public enum SyncOutcome {
    /**
     * Local and remote already matched, or nothing was stored yet.
     */
    CLEAN,
    RESOLVED,
    /**
     * Another sync was in flight.
     */
    SKIPPED,
    FAILED
}
