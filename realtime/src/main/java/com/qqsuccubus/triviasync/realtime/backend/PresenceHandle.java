package com.qqsuccubus.triviasync.realtime.backend;

import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import com.qqsuccubus.triviasync.core.msg.PresenceSignal;
import reactor.core.publisher.Mono;

/**
 * Presence channel handle. Tracking replaces whatever this handle tracked before.
 */
public interface PresenceHandle extends ChannelHandle<PresenceSignal> {

    Mono<Void> track(PresenceRecord record);

    Mono<Void> untrack();
}
