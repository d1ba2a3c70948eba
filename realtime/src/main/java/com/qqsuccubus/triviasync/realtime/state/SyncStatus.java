package com.qqsuccubus.triviasync.realtime.state;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncStatus {
    boolean inProgress;
    boolean pendingSync;
    long currentVersion;
    long lastSyncTime;
    int historySize;
    String lastError;
}
