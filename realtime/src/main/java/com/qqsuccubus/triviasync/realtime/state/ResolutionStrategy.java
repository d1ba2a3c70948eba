package com.qqsuccubus.triviasync.realtime.state;

public enum ResolutionStrategy {
    LOCAL_WINS,
    REMOTE_WINS,
    LATEST_TIMESTAMP,
    MERGE
}
