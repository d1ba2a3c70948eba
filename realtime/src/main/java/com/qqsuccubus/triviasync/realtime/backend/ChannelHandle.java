package com.qqsuccubus.triviasync.realtime.backend;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Transport handle for one channel subscription.
 * <p>
 * A handle is single use: after {@link #unsubscribe()} or a transport close, the owner asks the
 * backend for a fresh handle instead of resubscribing this one.
 * </p>
 *
 * @param <E> event type delivered by the channel
 */
public interface ChannelHandle<E> {

    /**
     * @return backend channel name, used in logs
     */
    String name();

    /**
     * Joins the channel.
     *
     * @return Mono completing once the backend acknowledged the subscription, or failing with a
     * {@link ChannelException}
     */
    Mono<Void> subscribe();

    /**
     * @return events delivered on this channel after {@link #subscribe()} succeeded
     */
    Flux<E> events();

    Mono<Void> unsubscribe();
}
