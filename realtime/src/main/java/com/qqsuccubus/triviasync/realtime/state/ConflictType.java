package com.qqsuccubus.triviasync.realtime.state;

public enum ConflictType {
    VERSION,
    TIMESTAMP,
    CONCURRENT
}
