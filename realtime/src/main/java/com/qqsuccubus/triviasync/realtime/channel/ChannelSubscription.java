package com.qqsuccubus.triviasync.realtime.channel;

import com.qqsuccubus.triviasync.core.model.PresenceRecord;
import com.qqsuccubus.triviasync.realtime.backend.ChannelHandle;
import com.qqsuccubus.triviasync.realtime.backend.PresenceHandle;
import lombok.Getter;
import reactor.core.Disposable;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * One logical subscription owned by {@link ChannelManager}.
 * <p>
 * The id and listener survive reconnects; the transport handle is replaced each time the
 * subscription is restored.
 * </p>
 */
@Getter
public class ChannelSubscription {

    private final String id;
    private final SubscriptionKind kind;
    /**
     * Table or channel name.
     */
    private final String target;
    private final String event;
    private final String filter;
    private final long createdAt;

    private final Supplier<? extends ChannelHandle<?>> handleFactory;
    private final Consumer<Object> listener;

    private volatile ChannelHandle<?> handle;
    private volatile SubscriptionState state = SubscriptionState.CREATED;
    private volatile long lastActivity;
    private final AtomicInteger connectionAttempts = new AtomicInteger();
    private volatile PresenceRecord trackedPresence;
    private volatile Disposable eventStream;

    <E> ChannelSubscription(String id, SubscriptionKind kind, String target, String event, String filter,
                            long createdAt, Supplier<? extends ChannelHandle<E>> handleFactory,
                            Class<E> eventType, Consumer<E> listener) {
        this.id = id;
        this.kind = kind;
        this.target = target;
        this.event = event;
        this.filter = filter;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
        this.handleFactory = handleFactory;
        this.listener = evt -> listener.accept(eventType.cast(evt));
    }

    public boolean isActive() {
        return state == SubscriptionState.ACTIVE;
    }

    public int getConnectionAttempts() {
        return connectionAttempts.get();
    }

    ChannelHandle<?> newHandle() {
        ChannelHandle<?> next = handleFactory.get();
        this.handle = next;
        return next;
    }

    PresenceHandle presenceHandle() {
        return handle instanceof PresenceHandle presence ? presence : null;
    }

    int incrementConnectionAttempts() {
        return connectionAttempts.incrementAndGet();
    }

    void setState(SubscriptionState state) {
        this.state = state;
    }

    void touch(long now) {
        this.lastActivity = now;
    }

    void setTrackedPresence(PresenceRecord record) {
        this.trackedPresence = record;
    }

    void replaceEventStream(Disposable stream) {
        Disposable previous = this.eventStream;
        this.eventStream = stream;
        if (previous != null) {
            previous.dispose();
        }
    }

    void dispatch(Object event) {
        listener.accept(event);
    }

    ChannelHealth health() {
        return new ChannelHealth(id, kind, state, isActive(), lastActivity, connectionAttempts.get());
    }
}
