package com.qqsuccubus.triviasync.realtime.presence;

import com.qqsuccubus.triviasync.core.model.PresenceActivity;
import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import com.qqsuccubus.triviasync.core.model.PresenceStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PresenceEvent {
    PresenceEventType type;
    ContextType contextType;
    String contextId;
    /**
     * Affected record; null for {@link PresenceEventType#PRESENCE_SYNCED}.
     */
    PresenceRecord record;
    PresenceStatus previousStatus;
    PresenceActivity previousActivity;
    long timestamp;
}
