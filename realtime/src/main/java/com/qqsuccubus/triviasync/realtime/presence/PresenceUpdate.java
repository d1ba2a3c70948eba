package com.qqsuccubus.triviasync.realtime.presence;

import com.qqsuccubus.triviasync.core.model.NetworkQuality;
import com.qqsuccubus.triviasync.core.model.PresenceActivity;
import com.qqsuccubus.triviasync.core.model.PresenceStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Partial update of a local presence record. Null fields are left unchanged.
 */
@Value
@Builder
public class PresenceUpdate {
    PresenceStatus status;
    PresenceActivity activity;
    String teamId;
    String teamName;
    String gameRoomId;
    NetworkQuality networkQuality;
}
