package com.partner.match.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * {@link EvictionCache} that evicts the entry with the lowest
 * {@code accessCount / (ageMillis + 1)} when a new key arrives at capacity.
 * <p>
 * Expiry is checked lazily on read; {@link #evictExpired()} can be called to sweep
 * proactively. All state changes happen under a single lock.
 * </p>
 */
@Slf4j
public class ValueEvictionCache<K, V> implements EvictionCache<K, V> {
    private final String name;
    private final int capacity;
    private final long ttlMillis;
    private final Clock clock;
    private final Map<K, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private long hits;
    private long misses;

    public ValueEvictionCache(String name, int capacity, Duration ttl, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        this.name = name;
        this.capacity = capacity;
        this.ttlMillis = ttl.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<V> get(K key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (isExpired(entry, clock.instant())) {
                entries.remove(key);
                misses++;
                log.debug("Cache {} entry expired for key {}", name, key);
                return Optional.empty();
            }
            entry.recordAccess();
            hits++;
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            Instant now = clock.instant();
            if (!entries.containsKey(key) && entries.size() >= capacity) {
                evictLeastValuable(now);
            }
            entries.put(key, new CacheEntry<>(value, now));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public V getOrCompute(K key, Function<? super K, ? extends V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        // computed outside the lock; a concurrent loader for the same key just overwrites
        V value = loader.apply(key);
        set(key, value);
        return value;
    }

    @Override
    public void invalidate(K key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int invalidateIf(Predicate<? super K> predicate) {
        lock.lock();
        try {
            int before = entries.size();
            entries.keySet().removeIf(predicate);
            return before - entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int evictExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (isExpired(it.next(), now)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("Cache {} swept {} expired entries", name, removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            double averageAccess = entries.values().stream()
                    .mapToLong(CacheEntry::getAccessCount)
                    .average()
                    .orElse(0.0);
            return CacheStats.builder()
                    .size(entries.size())
                    .capacity(capacity)
                    .hits(hits)
                    .misses(misses)
                    .averageAccessCount(averageAccess)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    private boolean isExpired(CacheEntry<V> entry, Instant now) {
        return entry.ageMillis(now) > ttlMillis;
    }

    private void evictLeastValuable(Instant now) {
        K victim = null;
        double lowest = Double.POSITIVE_INFINITY;
        for (Map.Entry<K, CacheEntry<V>> e : entries.entrySet()) {
            double score = e.getValue().retentionScore(now);
            if (score < lowest) {
                lowest = score;
                victim = e.getKey();
            }
        }
        if (victim != null) {
            entries.remove(victim);
            log.debug("Cache {} at capacity {}; evicted key {} with retention score {}", name, capacity, victim, lowest);
        }
    }
}
