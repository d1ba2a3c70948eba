package com.qqsuccubus.triviasync.core.msg;

import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Presence event emitted by a presence subscription.
 * <p>
 * A {@link Kind#SYNC} carries the authoritative snapshot of the channel (presence key ->
 * tracked records); {@link Kind#JOIN} and {@link Kind#LEAVE} carry the records that changed.
 * </p>
 */
@Value
@Builder
@Jacksonized
public class PresenceSignal {

    public enum Kind {
        SYNC,
        JOIN,
        LEAVE
    }

    Kind kind;
    String key;
    @Builder.Default
    Map<String, List<PresenceRecord>> state = Map.of();
    @Builder.Default
    List<PresenceRecord> presences = List.of();

    public static PresenceSignal sync(Map<String, List<PresenceRecord>> state) {
        return PresenceSignal.builder().kind(Kind.SYNC).state(state).build();
    }

    public static PresenceSignal join(String key, List<PresenceRecord> joined) {
        return PresenceSignal.builder().kind(Kind.JOIN).key(key).presences(joined).build();
    }

    public static PresenceSignal leave(String key, List<PresenceRecord> left) {
        return PresenceSignal.builder().kind(Kind.LEAVE).key(key).presences(left).build();
    }
}
