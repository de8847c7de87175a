package com.partner.match.cache;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Bounded key-value store with time-to-live expiry and value-based eviction.
 *
 * @param <K> key type
 * @param <V> value type, never {@code null}
 */
public interface EvictionCache<K, V> {

    /**
     * Returns the live value for {@code key}. An entry older than the TTL is removed and
     * reported as absent.
     */
    Optional<V> get(K key);

    /**
     * Stores {@code value}. A new key arriving at full capacity evicts the least valuable
     * entry first; an existing key is refreshed in place.
     */
    void set(K key, V value);

    V getOrCompute(K key, Function<? super K, ? extends V> loader);

    void invalidate(K key);

    int invalidateIf(Predicate<? super K> predicate);

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    int evictExpired();

    void clear();

    int size();

    CacheStats stats();
}
