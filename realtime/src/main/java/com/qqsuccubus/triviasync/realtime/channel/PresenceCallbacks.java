package com.qqsuccubus.triviasync.realtime.channel;

import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Handlers for the three presence signal kinds. Missing handlers ignore their signal.
 */
@Value
@Builder
public class PresenceCallbacks {
    @Builder.Default
    Consumer<Map<String, List<PresenceRecord>>> onSync = state -> { };
    @Builder.Default
    BiConsumer<String, List<PresenceRecord>> onJoin = (key, joined) -> { };
    @Builder.Default
    BiConsumer<String, List<PresenceRecord>> onLeave = (key, left) -> { };
}
