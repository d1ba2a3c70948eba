package com.qqsuccubus.triviasync.realtime.presence;

import com.qqsuccubus.triviasync.core.model.PresenceActivity;
import com.qqsuccubus.triviasync.core.model.PresenceRole;
import com.qqsuccubus.triviasync.core.model.PresenceStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class PresenceMetrics {
    int totalUsers;
    int onlineUsers;
    Map<PresenceRole, Integer> usersByRole;
    Map<PresenceStatus, Integer> usersByStatus;
    Map<PresenceActivity, Integer> usersByActivity;
    int peakConcurrentUsers;
    /**
     * Running average of ended local sessions, in millis.
     */
    long averageSessionDurationMs;
}
