package com.qqsuccubus.triviasync.realtime.backend;

import com.qqsuccubus.triviasync.core.model.GameState;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State store held in memory, with optional read latency and failure injection.
 */
public class InMemoryStateStore implements RemoteStateStore {

    private final Map<String, RemoteSnapshot> snapshots = new ConcurrentHashMap<>();
    private final AtomicInteger reads = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();
    private final AtomicInteger readFailures = new AtomicInteger();
    private final AtomicInteger writeFailures = new AtomicInteger();

    private volatile Duration readDelay = Duration.ZERO;
    private volatile Scheduler delayScheduler;

    public void put(String entityId, GameState state, long version, long timestamp, String clientId) {
        snapshots.put(entityId, RemoteSnapshot.builder()
            .state(state)
            .version(version)
            .timestamp(timestamp)
            .clientId(clientId)
            .build());
    }

    public RemoteSnapshot get(String entityId) {
        return snapshots.get(entityId);
    }

    /**
     * Every read completes only after {@code delay} on {@code scheduler}.
     */
    public void delayReads(Duration delay, Scheduler scheduler) {
        this.readDelay = delay;
        this.delayScheduler = scheduler;
    }

    public void failReads(int times) {
        readFailures.set(times);
    }

    public void failWrites(int times) {
        writeFailures.set(times);
    }

    public int reads() {
        return reads.get();
    }

    public int writes() {
        return writes.get();
    }

    @Override
    public Mono<RemoteSnapshot> read(String entityId) {
        Mono<RemoteSnapshot> read = Mono.defer(() -> {
            reads.incrementAndGet();
            if (readFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                return Mono.error(new StateStoreException("read of " + entityId + " failed"));
            }
            return Mono.justOrEmpty(snapshots.get(entityId));
        });
        if (readDelay.isZero() || delayScheduler == null) {
            return read;
        }
        return Mono.delay(readDelay, delayScheduler).then(read);
    }

    @Override
    public Mono<Void> update(String entityId, GameState state, long version, long timestamp, String clientId) {
        return Mono.defer(() -> {
            writes.incrementAndGet();
            if (writeFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                return Mono.error(new StateStoreException("write of " + entityId + " failed"));
            }
            put(entityId, state, version, timestamp, clientId);
            return Mono.empty();
        });
    }
}
