package com.qqsuccubus.triviasync.realtime.optimizer;

import com.qqsuccubus.triviasync.core.hash.Checksums;
import com.qqsuccubus.triviasync.core.model.NetworkQuality;
import com.qqsuccubus.triviasync.core.util.JsonUtils;
import com.qqsuccubus.triviasync.realtime.config.SyncConfig;
import com.qqsuccubus.triviasync.realtime.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Adaptive performance controls for the sync layer.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Debounce and throttle wrappers keyed by caller-chosen names</li>
 *   <li>Priority cache with TTL</li>
 *   <li>Delta creation, buffering, compaction and periodic flush</li>
 *   <li>Per-entity conflict resolution strategies</li>
 *   <li>Rolling latency/throughput metrics, network quality and health score</li>
 * </ul>
 * </p>
 * <p>
 * Timers run on the injected scheduler and time is read from its clock, so a
 * {@code VirtualTimeScheduler} drives the whole component in tests.
 * </p>
 */
public class PerformanceOptimizer {
    private static final Logger log = LoggerFactory.getLogger(PerformanceOptimizer.class);

    private final SyncConfig config;
    private final MetricsService metricsService;
    private final Scheduler scheduler;

    private final PriorityCache cache;
    private final AtomicReference<OptimizationLevel> level = new AtomicReference<>(OptimizationLevel.MEDIUM);

    // Debounce/throttle state: key -> pending timer / window
    private final Map<String, Disposable> debounceTimers = new ConcurrentHashMap<>();
    private final Map<String, ThrottleWindow> throttleWindows = new ConcurrentHashMap<>();
    private final AtomicLong debouncedEvents = new AtomicLong();
    private final AtomicLong throttledEvents = new AtomicLong();

    // Deltas: entity:entityId -> buffered deltas
    private final Map<String, Deque<DeltaRecord>> deltaBuffers = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> deltaVersions = new ConcurrentHashMap<>();
    private final Sinks.Many<DeltaBatch> deltaSink = Sinks.many().multicast().directBestEffort();

    // Conflicts
    private final Map<String, ConflictStrategy> conflictStrategies = new ConcurrentHashMap<>();
    private final Map<String, ConflictResolver> customResolvers = new ConcurrentHashMap<>();
    private final Sinks.Many<ConflictPrompt> promptSink = Sinks.many().multicast().directBestEffort();

    // Rolling metrics
    private final Deque<Double> latencySamples = new ArrayDeque<>();
    private final AtomicLong intervalEvents = new AtomicLong();
    private final AtomicLong intervalDrops = new AtomicLong();
    private volatile double peakEventsPerSecond;
    private volatile PerformanceSnapshot lastSnapshot;
    private final Sinks.Many<PerformanceSnapshot> snapshotSink = Sinks.many().replay().latest();

    private final Disposable.Composite timers = Disposables.composite();

    public PerformanceOptimizer(SyncConfig config, MetricsService metricsService, Scheduler scheduler) {
        this.config = config;
        this.metricsService = metricsService;
        this.scheduler = scheduler;
        this.cache = new PriorityCache(config.getCacheCapacity(), this::now);
        metricsService.registerCacheSizeGauge(cache::size);
    }

    /**
     * Starts metrics collection and the periodic delta flush.
     */
    public void start() {
        timers.add(Flux.interval(config.getMetricsInterval(), config.getMetricsInterval(), scheduler)
            .subscribe(tick -> collectMetrics(),
                err -> log.error("Metrics collection stopped", err)));

        timers.add(Flux.interval(config.getDeltaFlushInterval(), config.getDeltaFlushInterval(), scheduler)
            .subscribe(tick -> flushDeltas(),
                err -> log.error("Delta flush stopped", err)));

        log.info("Performance optimizer started (level={}, cache capacity={})",
            level.get(), config.getCacheCapacity());
    }

    // ---------------------------------------------------------------- debounce / throttle

    /**
     * Wraps {@code fn} so that it only runs once calls under {@code key} have been quiet for the
     * configured delay. The last argument wins.
     *
     * @param key    Debounce key, shared by all wrappers created with it
     * @param fn     Function to debounce
     * @param debounce Delay configuration
     * @param <T>    Argument type
     * @return debounced wrapper
     */
    public <T> Consumer<T> debounce(String key, Consumer<T> fn, DebounceConfig debounce) {
        return arg -> {
            AtomicReference<Disposable> self = new AtomicReference<>();
            Disposable timer = Mono.delay(debounce.getDelay(), scheduler)
                .subscribe(tick -> {
                    debounceTimers.remove(key, self.get());
                    invokeSafely(key, fn, arg);
                });
            self.set(timer);

            Disposable previous = debounceTimers.put(key, timer);
            if (previous != null && !previous.isDisposed()) {
                previous.dispose();
                debouncedEvents.incrementAndGet();
                metricsService.recordOptimizerEvent("debounced");
            }
        };
    }

    /**
     * Debounce with the delay of the current optimization level.
     */
    public <T> Consumer<T> debounce(String key, Consumer<T> fn) {
        return debounce(key, fn, DebounceConfig.of(level.get().debounceDelay()));
    }

    /**
     * Wraps {@code fn} in a fixed-window throttle.
     *
     * @return wrapper answering whether the call went through
     */
    public <T> Predicate<T> throttle(String key, Consumer<T> fn, ThrottleConfig throttle) {
        long windowMillis = throttle.getWindow().toMillis();
        return arg -> {
            ThrottleWindow window = throttleWindows.computeIfAbsent(key, k -> new ThrottleWindow(now()));
            if (!window.tryAcquire(now(), windowMillis, throttle.getLimit())) {
                throttledEvents.incrementAndGet();
                intervalDrops.incrementAndGet();
                metricsService.recordOptimizerEvent("throttled");
                return false;
            }
            invokeSafely(key, fn, arg);
            return true;
        };
    }

    /**
     * Throttle with the limit of the current optimization level over a one second window.
     */
    public <T> Predicate<T> throttle(String key, Consumer<T> fn) {
        return throttle(key, fn, ThrottleConfig.of(level.get().throttleLimit(), OptimizationLevel.THROTTLE_WINDOW));
    }

    private <T> void invokeSafely(String key, Consumer<T> fn, T arg) {
        try {
            fn.accept(arg);
        } catch (RuntimeException e) {
            log.error("Wrapped function {} failed", key, e);
        }
    }

    // ---------------------------------------------------------------- cache

    public void setCache(String key, Object data) {
        setCache(key, data, level.get().cacheTtl(), 1);
    }

    public void setCache(String key, Object data, Duration ttl, int priority) {
        try {
            cache.put(key, data, ttl.toMillis(), priority);
        } catch (RuntimeException e) {
            log.warn("Failed to cache {}", key, e);
        }
    }

    public Optional<Object> getCache(String key) {
        Optional<Object> value = cache.get(key);
        metricsService.recordOptimizerEvent(value.isPresent() ? "cache_hit" : "cache_miss");
        return value;
    }

    public <T> Optional<T> getCache(String key, Class<T> type) {
        return getCache(key).filter(type::isInstance).map(type::cast);
    }

    public boolean invalidateCache(String key) {
        return cache.invalidate(key);
    }

    public void clearCache() {
        cache.clear();
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    // ---------------------------------------------------------------- deltas

    /**
     * Creates a delta and appends it to the buffer of its entity instance.
     *
     * @param entityId  Entity instance id
     * @param operation Operation
     * @param entity    Entity name, e.g. {@code "player"}
     * @param changes   Changed fields (full record for CREATE)
     * @param previous  Previous values of the changed fields, may be null
     * @return the buffered delta
     */
    public DeltaRecord createDelta(String entityId, DeltaOperation operation, String entity,
                                   Map<String, Object> changes, Map<String, Object> previous) {
        String entityKey = entity + ":" + entityId;
        long version = deltaVersions.computeIfAbsent(entityKey, k -> new AtomicLong()).incrementAndGet();
        long timestamp = now();

        DeltaRecord delta = DeltaRecord.builder()
            .id(entityKey + ":" + version)
            .entity(entity)
            .entityId(entityId)
            .timestamp(timestamp)
            .operation(operation)
            .changes(changes == null ? Map.of() : changes)
            .previous(previous)
            .version(version)
            .checksum(checksum(changes))
            .build();

        Deque<DeltaRecord> buffer = deltaBuffers.computeIfAbsent(entityKey, k -> new ArrayDeque<>());
        synchronized (buffer) {
            buffer.addLast(delta);
            while (buffer.size() > config.getDeltaBufferCapacity()) {
                DeltaRecord dropped = buffer.pollFirst();
                log.warn("Delta buffer for {} full, dropping {}", entityKey, dropped.getId());
            }
        }
        return delta;
    }

    public DeltaRecord createDelta(String entityId, DeltaOperation operation, String entity, Map<String, Object> changes) {
        return createDelta(entityId, operation, entity, changes, null);
    }

    /**
     * Compacts deltas: groups by entity instance, orders by timestamp and folds every run of
     * consecutive UPDATEs into one (later field values win).
     *
     * @param deltas Deltas in any order
     * @return compacted deltas, grouped by entity instance in first-seen order
     */
    public List<DeltaRecord> optimizeDeltas(List<DeltaRecord> deltas) {
        Map<String, List<DeltaRecord>> byEntity = new LinkedHashMap<>();
        for (DeltaRecord delta : deltas) {
            byEntity.computeIfAbsent(delta.entityKey(), k -> new ArrayList<>()).add(delta);
        }

        List<DeltaRecord> result = new ArrayList<>();
        for (List<DeltaRecord> group : byEntity.values()) {
            group.sort(Comparator.comparingLong(DeltaRecord::getTimestamp));

            DeltaRecord pending = null;
            for (DeltaRecord delta : group) {
                if (pending != null
                    && pending.getOperation() == DeltaOperation.UPDATE
                    && delta.getOperation() == DeltaOperation.UPDATE) {
                    pending = mergeUpdates(pending, delta);
                } else {
                    if (pending != null) {
                        result.add(pending);
                    }
                    pending = delta;
                }
            }
            if (pending != null) {
                result.add(pending);
            }
        }
        return result;
    }

    private DeltaRecord mergeUpdates(DeltaRecord earlier, DeltaRecord later) {
        Map<String, Object> changes = new LinkedHashMap<>(earlier.getChanges());
        changes.putAll(later.getChanges());

        Map<String, Object> previous = null;
        if (earlier.getPrevious() != null || later.getPrevious() != null) {
            previous = new LinkedHashMap<>();
            if (earlier.getPrevious() != null) {
                previous.putAll(earlier.getPrevious());
            }
            if (later.getPrevious() != null) {
                later.getPrevious().forEach(previous::putIfAbsent);
            }
        }

        return later.toBuilder()
            .changes(changes)
            .previous(previous)
            .checksum(checksum(changes))
            .build();
    }

    /**
     * Applies one delta to an entity state.
     *
     * @return new state, or empty for a DELETE
     */
    public Optional<Map<String, Object>> applyDelta(DeltaRecord delta, Map<String, Object> state) {
        if (!Objects.equals(delta.getChecksum(), checksum(delta.getChanges()))) {
            log.warn("Checksum mismatch for delta {}, applying anyway", delta.getId());
        }
        return switch (delta.getOperation()) {
            case CREATE -> Optional.of(new LinkedHashMap<>(delta.getChanges()));
            case UPDATE -> {
                Map<String, Object> next = state == null ? new LinkedHashMap<>() : new LinkedHashMap<>(state);
                next.putAll(delta.getChanges());
                yield Optional.of(next);
            }
            case DELETE -> Optional.empty();
        };
    }

    /**
     * Compacts and emits every buffered delta. Runs on the flush timer.
     */
    public void flushDeltas() {
        long flushedAt = now();
        for (Map.Entry<String, Deque<DeltaRecord>> entry : deltaBuffers.entrySet()) {
            List<DeltaRecord> drained;
            Deque<DeltaRecord> buffer = entry.getValue();
            synchronized (buffer) {
                if (buffer.isEmpty()) {
                    continue;
                }
                drained = new ArrayList<>(buffer);
                buffer.clear();
            }

            List<DeltaRecord> compacted;
            try {
                compacted = optimizeDeltas(drained);
            } catch (RuntimeException e) {
                log.warn("Delta compaction failed for {}, flushing raw deltas", entry.getKey(), e);
                compacted = drained;
            }

            DeltaRecord first = compacted.get(0);
            deltaSink.tryEmitNext(new DeltaBatch(first.getEntity(), first.getEntityId(), compacted, flushedAt));
        }
    }

    public Flux<DeltaBatch> deltaBatches() {
        return deltaSink.asFlux();
    }

    public List<DeltaRecord> getBufferedDeltas(String entity, String entityId) {
        Deque<DeltaRecord> buffer = deltaBuffers.get(entity + ":" + entityId);
        if (buffer == null) {
            return List.of();
        }
        synchronized (buffer) {
            return List.copyOf(buffer);
        }
    }

    static String checksum(Map<String, Object> changes) {
        // Mapper sorts map keys, so the checksum is order independent
        return Checksums.murmur3Base36(JsonUtils.writeValueAsString(changes == null ? Map.of() : changes));
    }

    // ---------------------------------------------------------------- conflicts

    public void setConflictResolver(String entity, ConflictStrategy strategy) {
        conflictStrategies.put(entity, strategy);
    }

    public void setConflictResolver(String entity, ConflictResolver resolver) {
        customResolvers.put(entity, resolver);
        conflictStrategies.put(entity, ConflictStrategy.CUSTOM);
    }

    /**
     * Resolves a conflict with the strategy registered for {@code entity} (default
     * {@link ConflictStrategy#LAST_WRITE_WINS}). Failures fall back to the remote version.
     *
     * @return resolved version, or empty when the user has to choose
     */
    public Optional<Map<String, Object>> resolveConflict(String entity, Map<String, Object> local,
                                                         Map<String, Object> remote, Map<String, Object> base) {
        return resolveConflict(entity, local, timestampOf(local), remote, timestampOf(remote), base);
    }

    /**
     * Same as {@link #resolveConflict(String, Map, Map, Map)} with the write times of both sides
     * given explicitly instead of read from their {@code timestamp} fields.
     */
    public Optional<Map<String, Object>> resolveConflict(String entity, Map<String, Object> local, long localTimestamp,
                                                         Map<String, Object> remote, long remoteTimestamp,
                                                         Map<String, Object> base) {
        ConflictStrategy strategy = conflictStrategies.getOrDefault(entity, ConflictStrategy.LAST_WRITE_WINS);
        try {
            Optional<Map<String, Object>> resolved = switch (strategy) {
                case LAST_WRITE_WINS -> Optional.of(localTimestamp > remoteTimestamp ? local : remote);
                case MERGE -> Optional.of(threeWayMerge(local, remote, base));
                case USER_CHOICE -> {
                    promptSink.tryEmitNext(new ConflictPrompt(entity, local, remote, base, now()));
                    yield Optional.empty();
                }
                case CUSTOM -> {
                    ConflictResolver resolver = customResolvers.get(entity);
                    if (resolver == null) {
                        log.warn("No custom resolver for {}, keeping remote", entity);
                        yield Optional.of(remote);
                    }
                    yield Optional.ofNullable(resolver.resolve(local, remote, base));
                }
            };
            metricsService.recordOptimizerEvent("conflict_resolved");
            return resolved;
        } catch (RuntimeException e) {
            log.error("Conflict resolution for {} failed, keeping remote", entity, e);
            return Optional.of(remote);
        }
    }

    public Flux<ConflictPrompt> conflictPrompts() {
        return promptSink.asFlux();
    }

    private static long timestampOf(Map<String, Object> value) {
        Object ts = value == null ? null : value.get("timestamp");
        return ts instanceof Number number ? number.longValue() : 0L;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> threeWayMerge(Map<String, Object> local, Map<String, Object> remote,
                                             Map<String, Object> base) {
        Map<String, Object> safeLocal = local == null ? Map.of() : local;
        Map<String, Object> safeRemote = remote == null ? Map.of() : remote;
        Map<String, Object> safeBase = base == null ? Map.of() : base;

        Set<String> keys = new HashSet<>(safeLocal.keySet());
        keys.addAll(safeRemote.keySet());

        Map<String, Object> merged = new LinkedHashMap<>();
        for (String key : keys) {
            Object l = safeLocal.get(key);
            Object r = safeRemote.get(key);
            Object b = safeBase.get(key);

            Object value;
            if (Objects.equals(l, r)) {
                value = l;
            } else if (Objects.equals(l, b)) {
                value = r;
            } else if (Objects.equals(r, b)) {
                value = l;
            } else if (l instanceof Map && r instanceof Map) {
                value = threeWayMerge((Map<String, Object>) l, (Map<String, Object>) r,
                    b instanceof Map ? (Map<String, Object>) b : null);
            } else {
                value = r;
            }
            if (value != null || safeLocal.containsKey(key) && safeRemote.containsKey(key)) {
                merged.put(key, value);
            }
        }
        return merged;
    }

    // ---------------------------------------------------------------- metrics

    public void recordLatency(double millis) {
        synchronized (latencySamples) {
            latencySamples.addLast(millis);
            while (latencySamples.size() > config.getLatencyWindow()) {
                latencySamples.pollFirst();
            }
        }
    }

    public void recordEvent() {
        intervalEvents.incrementAndGet();
    }

    public void recordDroppedEvent() {
        intervalDrops.incrementAndGet();
    }

    /**
     * Computes a snapshot for the elapsed interval, resets interval counters, adapts the
     * optimization level and publishes the snapshot.
     */
    public PerformanceSnapshot collectMetrics() {
        List<Double> samples;
        synchronized (latencySamples) {
            samples = new ArrayList<>(latencySamples);
        }
        samples.sort(Double::compare);

        double avg = samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        long events = intervalEvents.getAndSet(0);
        long drops = intervalDrops.getAndSet(0);
        double intervalSeconds = config.getMetricsInterval().toMillis() / 1000.0;
        double eventsPerSecond = intervalSeconds > 0 ? events / intervalSeconds : 0.0;
        peakEventsPerSecond = Math.max(peakEventsPerSecond, eventsPerSecond);
        double dropRate = events + drops == 0 ? 0.0 : (double) drops / (events + drops);

        NetworkQuality quality = classify(avg, dropRate);
        adaptLevel(quality);
        CacheStats cacheStats = cache.stats();

        PerformanceSnapshot snapshot = PerformanceSnapshot.builder()
            .timestamp(now())
            .averageLatencyMs(avg)
            .minLatencyMs(samples.isEmpty() ? 0.0 : samples.get(0))
            .maxLatencyMs(samples.isEmpty() ? 0.0 : samples.get(samples.size() - 1))
            .p95LatencyMs(percentile(samples, 0.95))
            .p99LatencyMs(percentile(samples, 0.99))
            .eventsPerSecond(eventsPerSecond)
            .peakEventsPerSecond(peakEventsPerSecond)
            .debouncedEvents(debouncedEvents.get())
            .throttledEvents(throttledEvents.get())
            .dropRate(dropRate)
            .cacheSize(cacheStats.getSize())
            .cacheHitRate(cacheStats.getHitRate())
            .networkQuality(quality)
            .optimizationLevel(level.get())
            .healthScore(healthScore(avg, eventsPerSecond, quality))
            .build();

        lastSnapshot = snapshot;
        snapshotSink.tryEmitNext(snapshot);
        return snapshot;
    }

    private void adaptLevel(NetworkQuality quality) {
        if (!config.isAdaptiveOptimization()) {
            return;
        }
        OptimizationLevel recommended = OptimizationLevel.recommendedFor(quality);
        OptimizationLevel previous = level.getAndSet(recommended);
        if (previous != recommended) {
            log.info("Network quality {}, optimization level {} -> {}", quality, previous, recommended);
        }
    }

    static NetworkQuality classify(double avgLatencyMs, double dropRate) {
        if (avgLatencyMs < 50 && dropRate < 0.01) {
            return NetworkQuality.EXCELLENT;
        }
        if (avgLatencyMs < 100 && dropRate < 0.05) {
            return NetworkQuality.GOOD;
        }
        if (avgLatencyMs < 200 && dropRate < 0.1) {
            return NetworkQuality.POOR;
        }
        return NetworkQuality.CRITICAL;
    }

    static double healthScore(double avgLatencyMs, double eventsPerSecond, NetworkQuality quality) {
        double latencyScore = Math.max(0, 100 - avgLatencyMs / 2);
        double throughputScore = Math.min(100, eventsPerSecond * 10);
        double qualityScore = switch (quality) {
            case EXCELLENT -> 100;
            case GOOD -> 80;
            case POOR -> 50;
            case CRITICAL -> 20;
            case OFFLINE -> 0;
        };
        return (latencyScore + throughputScore + qualityScore) / 3;
    }

    private static double percentile(List<Double> sorted, double p) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.ceil(p * sorted.size()) - 1;
        return sorted.get(Math.max(0, Math.min(index, sorted.size() - 1)));
    }

    public Flux<PerformanceSnapshot> snapshots() {
        return snapshotSink.asFlux();
    }

    public Optional<PerformanceSnapshot> getLastSnapshot() {
        return Optional.ofNullable(lastSnapshot);
    }

    /**
     * @return health score of the last snapshot, 100 before the first collection
     */
    public double getHealthScore() {
        PerformanceSnapshot snapshot = lastSnapshot;
        return snapshot == null ? 100.0 : snapshot.getHealthScore();
    }

    public long getDebouncedEvents() {
        return debouncedEvents.get();
    }

    public long getThrottledEvents() {
        return throttledEvents.get();
    }

    public OptimizationLevel getOptimizationLevel() {
        return level.get();
    }

    public void setOptimizationLevel(OptimizationLevel newLevel) {
        OptimizationLevel previous = level.getAndSet(newLevel);
        log.info("Optimization level set {} -> {}", previous, newLevel);
    }

    public void dispose() {
        timers.dispose();
        debounceTimers.values().forEach(Disposable::dispose);
        debounceTimers.clear();
        throttleWindows.clear();
        deltaSink.tryEmitComplete();
        promptSink.tryEmitComplete();
        snapshotSink.tryEmitComplete();
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    /**
     * Fixed counting window of one throttle key.
     */
    private static final class ThrottleWindow {
        private long start;
        private int count;

        ThrottleWindow(long start) {
            this.start = start;
        }

        synchronized boolean tryAcquire(long now, long windowMillis, int limit) {
            if (now - start >= windowMillis) {
                start = now;
                count = 0;
            }
            if (count >= limit) {
                return false;
            }
            count++;
            return true;
        }
    }
}
