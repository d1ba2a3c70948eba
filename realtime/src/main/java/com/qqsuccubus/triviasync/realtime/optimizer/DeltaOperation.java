package com.qqsuccubus.triviasync.realtime.optimizer;

public enum DeltaOperation {
    CREATE,
    UPDATE,
    DELETE
}
