package com.partner.match.cache;

import lombok.Getter;

import java.time.Instant;

@Getter
public class CacheEntry<V> {
    private final V value;
    private final Instant createdAt;
    private long accessCount;

    public CacheEntry(V value, Instant createdAt) {
        this.value = value;
        this.createdAt = createdAt;
        this.accessCount = 1;
    }

    void recordAccess() {
        accessCount++;
    }

    long ageMillis(Instant now) {
        return Math.max(0L, now.toEpochMilli() - createdAt.toEpochMilli());
    }

    /**
     * Retention value: frequently read, recently written entries score highest.
     */
    double retentionScore(Instant now) {
        return accessCount / (ageMillis(now) + 1.0);
    }
}
