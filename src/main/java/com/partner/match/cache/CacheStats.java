package com.partner.match.cache;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    int size;
    int capacity;
    long hits;
    long misses;
    double averageAccessCount;

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
