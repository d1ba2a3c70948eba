package com.qqsuccubus.triviasync.realtime.optimizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Bounded cache with per-entry TTL and priority-aware eviction.
 * <p>
 * When full, expired entries are purged first. If that frees no room, a fifth of the capacity is
 * evicted at once: lowest priority first, then the entries with the fewest hits per millisecond
 * of age. Otherwise expired entries are dropped lazily on read.
 * </p>
 */
public class PriorityCache {
    private static final Logger log = LoggerFactory.getLogger(PriorityCache.class);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final int capacity;
    private final LongSupplier clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public PriorityCache(int capacity, LongSupplier clock) {
        this.capacity = capacity;
        this.clock = clock;
    }

    public void put(String key, Object data, long ttlMillis, int priority) {
        if (!entries.containsKey(key) && entries.size() >= capacity) {
            evict();
        }
        entries.put(key, new CacheEntry(data, clock.getAsLong(), ttlMillis, 0, priority));
    }

    public Optional<Object> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(clock.getAsLong())) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }
        entries.computeIfPresent(key, (k, current) -> current.withHits(current.getHits() + 1));
        hits.incrementAndGet();
        return Optional.ofNullable(entry.getData());
    }

    public boolean invalidate(String key) {
        return entries.remove(key) != null;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        return CacheStats.builder()
                .size(entries.size())
                .capacity(capacity)
                .hits(h)
                .misses(m)
                .evictions(evictions.get())
                .hitRate(h + m == 0 ? 0.0 : (double) h / (h + m))
                .build();
    }

    /**
     * @return number of entries evicted
     */
    int evict() {
        long now = clock.getAsLong();
        int expired = purgeExpired(now);
        if (entries.size() < capacity) {
            evictions.addAndGet(expired);
            log.debug("Purged {} expired cache entries (capacity {})", expired, capacity);
            return expired;
        }
        int toEvict = Math.max(1, (int) Math.floor(capacity * 0.2));

        List<Map.Entry<String, CacheEntry>> candidates = new ArrayList<>(entries.entrySet());
        candidates.sort(Comparator
                .comparingInt((Map.Entry<String, CacheEntry> e) -> e.getValue().getPriority())
                .thenComparingDouble(e -> e.getValue().hitRate(now)));

        int evicted = 0;
        for (Map.Entry<String, CacheEntry> candidate : candidates) {
            if (evicted >= toEvict) {
                break;
            }
            if (entries.remove(candidate.getKey(), candidate.getValue())) {
                evicted++;
            }
        }
        evictions.addAndGet(expired + evicted);
        log.debug("Evicted {} cache entries and {} expired ones (capacity {})", evicted, expired, capacity);
        return expired + evicted;
    }

    private int purgeExpired(long now) {
        int purged = 0;
        for (Map.Entry<String, CacheEntry> entry : List.copyOf(entries.entrySet())) {
            if (entry.getValue().isExpired(now) && entries.remove(entry.getKey(), entry.getValue())) {
                purged++;
            }
        }
        return purged;
    }
}
