package com.qqsuccubus.triviasync.realtime.state;

import com.qqsuccubus.triviasync.core.model.GameState;
import com.qqsuccubus.triviasync.core.util.JitterBackoff;
import com.qqsuccubus.triviasync.realtime.backend.RemoteSnapshot;
import com.qqsuccubus.triviasync.realtime.backend.RemoteStateStore;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import com.qqsuccubus.triviasync.realtime.metrics.MetricsService;
import com.qqsuccubus.triviasync.realtime.optimizer.PerformanceOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Keeps one game state in sync with the authoritative store.
 * <p>
 * A sync reads the remote snapshot, detects conflicts against the local state, resolves them
 * with the requested strategy and writes the result back with the next version. Only one sync
 * runs at a time; a call arriving meanwhile is answered with {@link SyncOutcome#SKIPPED}.
 * </p>
 * <p>
 * Remote reads and writes are retried with jittered exponential backoff. Exhausted retries
 * produce a {@link SyncOutcome#FAILED} result instead of an error signal.
 * </p>
 */
public class StateSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(StateSynchronizer.class);

    static final String ATTRIBUTES_ENTITY = "game_state";
    private static final Duration RETRY_MAX = Duration.ofSeconds(30);

    private final String entityId;
    private final RemoteStateStore store;
    private final PerformanceOptimizer optimizer;
    private final MetricsService metricsService;
    private final SyncConfig config;
    private final Scheduler scheduler;

    private final AtomicBoolean inProgress = new AtomicBoolean(false);
    private volatile boolean pendingSync;
    private final AtomicReference<GameState> pendingState = new AtomicReference<>();
    private volatile SyncOptions pendingOptions;

    private volatile long currentVersion;
    private volatile long lastSyncTime;
    private volatile String lastError;
    private final Deque<StateVersion> history = new ArrayDeque<>();

    private final Sinks.Many<SyncResult> syncSink = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<StateConflict> conflictSink = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<Throwable> errorSink = Sinks.many().multicast().directBestEffort();

    public StateSynchronizer(String entityId, RemoteStateStore store, PerformanceOptimizer optimizer,
                             MetricsService metricsService, SyncConfig config, Scheduler scheduler) {
        this.entityId = entityId;
        this.store = store;
        this.optimizer = optimizer;
        this.metricsService = metricsService;
        this.config = config;
        this.scheduler = scheduler;
    }

    /**
     * Synchronizes {@code localState} with the store.
     *
     * @param localState State as seen by this client
     * @param options    Strategy and overrides
     * @return result of the sync; never an error signal
     */
    public Mono<SyncResult> syncState(GameState localState, SyncOptions options) {
        return Mono.defer(() -> {
            if (!inProgress.compareAndSet(false, true)) {
                pendingSync = true;
                pendingState.set(localState);
                pendingOptions = options;
                metricsService.recordSync("skipped");
                log.debug("Sync of {} already in progress, marking pending", entityId);
                return Mono.just(SyncResult.skipped(now()));
            }

            long startNanos = System.nanoTime();
            return store.read(entityId)
                .retryWhen(retry())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(remote -> reconcile(localState, remote.orElse(null), options))
                .doOnNext(result -> {
                    lastSyncTime = result.getTimestamp();
                    lastError = null;
                    metricsService.recordSync(result.getOutcome().name().toLowerCase());
                    metricsService.recordSyncLatency(startNanos);
                    emit(syncSink, result);
                })
                .onErrorResume(err -> {
                    log.error("Sync of {} failed", entityId, err);
                    lastError = err.getMessage();
                    metricsService.recordSync("failed");
                    emit(errorSink, err);
                    return Mono.just(SyncResult.failed(err, now()));
                })
                .doFinally(signal -> {
                    inProgress.set(false);
                    replayPending();
                });
        });
    }

    public Mono<SyncResult> syncState(GameState localState) {
        return syncState(localState, SyncOptions.defaults());
    }

    private void replayPending() {
        boolean wasPending = pendingSync;
        pendingSync = false;
        GameState next = pendingState.getAndSet(null);
        SyncOptions options = pendingOptions;
        pendingOptions = null;

        if (wasPending && next != null && options != null && options.isFollowUp()) {
            log.debug("Replaying pending sync of {}", entityId);
            syncState(next, options.withFollowUp(false))
                .subscribe(result -> { },
                    err -> log.error("Follow-up sync of {} failed", entityId, err));
        }
    }

    private Mono<SyncResult> reconcile(GameState localState, RemoteSnapshot remote, SyncOptions options) {
        long now = now();
        long localTimestamp = localState.getLastUpdated() > 0 ? localState.getLastUpdated() : now;
        StateVersion local = StateVersion.of(currentVersion, localState, localTimestamp, config.getClientId());

        if (remote == null || remote.getState() == null) {
            log.info("No stored state for {}, writing initial version", entityId);
            return write(localState, currentVersion + 1, now, null, SyncOutcome.CLEAN);
        }

        StateVersion remoteVersion = StateVersion.of(remote.getVersion(), remote.getState(),
            remote.getTimestamp(), remote.getClientId());

        Optional<StateConflict> conflict = ConflictDetector.detect(local, remoteVersion,
            config.getConcurrentWindow().toMillis());

        if (conflict.isEmpty()) {
            currentVersion = Math.max(currentVersion, remote.getVersion());
            return Mono.just(SyncResult.builder()
                .success(true)
                .outcome(SyncOutcome.CLEAN)
                .state(localState)
                .version(currentVersion)
                .timestamp(now)
                .build());
        }

        StateConflict detected = conflict.get();
        metricsService.recordConflict(detected.getType().name().toLowerCase());
        emit(conflictSink, detected);
        log.info("Conflict on {}: {} in {}", entityId, detected.getType(), detected.getFields());

        GameState resolved = resolve(detected, options);
        long nextVersion = Math.max(currentVersion, remote.getVersion()) + 1;
        return write(resolved, nextVersion, now, detected, SyncOutcome.RESOLVED);
    }

    GameState resolve(StateConflict conflict, SyncOptions options) {
        StateVersion local = conflict.getLocal();
        StateVersion remote = conflict.getRemote();
        if (options.isForceLocal()) {
            return local.getState();
        }
        if (options.isForceRemote()) {
            return remote.getState();
        }
        return switch (options.getStrategy()) {
            case LOCAL_WINS -> local.getState();
            case REMOTE_WINS -> remote.getState();
            case LATEST_TIMESTAMP -> local.getTimestamp() > remote.getTimestamp() ? local.getState() : remote.getState();
            case MERGE -> GameStateMerger.merge(local, remote, this::mergeAttributes);
        };
    }

    private Map<String, Object> mergeAttributes(Map<String, Object> local, long localTimestamp,
                                                Map<String, Object> remote, long remoteTimestamp) {
        if (local.equals(remote)) {
            return remote;
        }
        return optimizer.resolveConflict(ATTRIBUTES_ENTITY, local, localTimestamp, remote, remoteTimestamp, null)
            .orElse(remote);
    }

    private Mono<SyncResult> write(GameState state, long version, long now, StateConflict conflict, SyncOutcome outcome) {
        GameState stamped = state.withLastUpdated(now);
        return store.update(entityId, stamped, version, now, config.getClientId())
            .retryWhen(retry())
            .then(Mono.fromCallable(() -> {
                currentVersion = version;
                appendHistory(StateVersion.of(version, stamped, now, config.getClientId()));
                return SyncResult.builder()
                    .success(true)
                    .outcome(outcome)
                    .state(stamped)
                    .version(version)
                    .conflict(conflict)
                    .timestamp(now)
                    .build();
            }));
    }

    private Retry retry() {
        return JitterBackoff.retry(config.getSyncMaxRetries(), config.getSyncRetryBase(), RETRY_MAX,
            config.getSyncRetryJitter(), scheduler);
    }

    // ---------------------------------------------------------------- history

    private void appendHistory(StateVersion version) {
        synchronized (history) {
            history.addLast(version);
            while (history.size() > config.getHistoryCapacity()) {
                history.pollFirst();
            }
        }
    }

    /**
     * @return up to {@code limit} most recent versions, oldest first
     */
    public List<StateVersion> getHistory(int limit) {
        synchronized (history) {
            List<StateVersion> all = new ArrayList<>(history);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    /**
     * Writes a historical state back to the store as the next version. A failed write-back is
     * logged and reported to error listeners; the retained snapshot is returned either way.
     *
     * @return the restored state, or empty if the version is no longer in history
     */
    public Mono<GameState> rollbackToVersion(long version) {
        return Mono.defer(() -> {
            Optional<StateVersion> target;
            synchronized (history) {
                target = history.stream().filter(v -> v.getVersion() == version).findFirst();
            }
            if (target.isEmpty()) {
                log.warn("Version {} of {} not in history", version, entityId);
                return Mono.empty();
            }
            log.info("Rolling {} back to version {}", entityId, version);
            GameState snapshot = target.get().getState();
            return write(snapshot, currentVersion + 1, now(), null, SyncOutcome.RESOLVED)
                .map(SyncResult::getState)
                .onErrorResume(err -> {
                    log.error("Write-back of version {} of {} failed", version, entityId, err);
                    lastError = err.getMessage();
                    emit(errorSink, err);
                    return Mono.just(snapshot);
                });
        });
    }

    // ---------------------------------------------------------------- listeners / status

    public Disposable onSync(Consumer<SyncResult> listener) {
        return syncSink.asFlux().subscribe(listener);
    }

    public Disposable onConflict(Consumer<StateConflict> listener) {
        return conflictSink.asFlux().subscribe(listener);
    }

    public Disposable onError(Consumer<Throwable> listener) {
        return errorSink.asFlux().subscribe(listener);
    }

    private static <T> void emit(Sinks.Many<T> sink, T value) {
        synchronized (sink) {
            sink.tryEmitNext(value);
        }
    }

    public SyncStatus getSyncStatus() {
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        return SyncStatus.builder()
            .inProgress(inProgress.get())
            .pendingSync(pendingSync)
            .currentVersion(currentVersion)
            .lastSyncTime(lastSyncTime)
            .historySize(historySize)
            .lastError(lastError)
            .build();
    }

    public String getEntityId() {
        return entityId;
    }

    public void dispose() {
        syncSink.tryEmitComplete();
        conflictSink.tryEmitComplete();
        errorSink.tryEmitComplete();
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}
