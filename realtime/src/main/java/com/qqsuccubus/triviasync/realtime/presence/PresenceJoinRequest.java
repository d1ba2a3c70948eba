package com.qqsuccubus.triviasync.realtime.presence;

import com.qqsuccubus.triviasync.core.model.PresenceActivity;
import com.qqsuccubus.triviasync.core.model.PresenceRole;
import com.qqsuccubus.triviasync.core.model.PresenceStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PresenceJoinRequest {
    String userId;
    String username;
    String displayName;
    String avatarUrl;
    @Builder.Default
    PresenceRole role = PresenceRole.PLAYER;
    String teamId;
    String teamName;
    String gameRoomId;
    /**
     * Browser user agent, used for the device fingerprint.
     */
    String userAgent;
    @Builder.Default
    PresenceStatus status = PresenceStatus.ONLINE;
    @Builder.Default
    PresenceActivity activity = PresenceActivity.LOBBY;
}
