package com.qqsuccubus.triviasync.realtime.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.triviasync.core.msg.BroadcastMessage;
import com.qqsuccubus.triviasync.core.msg.ConnectionEvent;
import com.qqsuccubus.triviasync.core.msg.TableChange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Hosted realtime backend: table change feeds, broadcast channels, presence channels and RPC.
 * <p>
 * The channel factory methods only create handles; nothing is sent until
 * {@link ChannelHandle#subscribe()} is called.
 * </p>
 */
public interface RealtimeBackend {

    /**
     * @param table  Table name
     * @param filter Row filter in {@code column=eq.value} form, or null for all rows
     * @param event  {@code INSERT}, {@code UPDATE}, {@code DELETE} or {@code *}
     * @return unsubscribed handle
     */
    ChannelHandle<TableChange> tableChannel(String table, String filter, String event);

    /**
     * @param channel Broadcast channel name
     * @param event   Event name or {@code *}
     * @return unsubscribed handle
     */
    ChannelHandle<BroadcastMessage> broadcastChannel(String channel, String event);

    /**
     * @param channel     Presence channel name
     * @param presenceKey Key this client's records are tracked under
     * @return unsubscribed handle
     */
    PresenceHandle presenceChannel(String channel, String presenceKey);

    Mono<Void> publish(String channel, String event, JsonNode payload);

    /**
     * Invokes a server-side function.
     *
     * @param function Function name
     * @param params   Named parameters
     * @return function result
     */
    Mono<JsonNode> rpc(String function, Map<String, Object> params);

    /**
     * @return transport lifecycle events (hot, never completes while the backend is open)
     */
    Flux<ConnectionEvent> connectionEvents();

    Mono<Void> connect();

    Mono<Void> close();
}
