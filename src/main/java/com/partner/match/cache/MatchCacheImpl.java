package com.partner.match.cache;

import com.partner.match.dto.MatchCacheKey;
import com.partner.match.dto.MatchResult;
import com.partner.match.metrics.MatchingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;


@Slf4j
@Component
public class MatchCacheImpl implements MatchCache {
    private final EvictionCache<MatchCacheKey, List<MatchResult>> cache;
    private final MatchingMetrics metrics;

    public MatchCacheImpl(@Qualifier("matchResultCache") EvictionCache<MatchCacheKey, List<MatchResult>> cache,
                          MatchingMetrics metrics) {
        this.cache = cache;
        this.metrics = metrics;
    }

    @Override
    public Optional<List<MatchResult>> getMatches(MatchCacheKey key) {
        Optional<List<MatchResult>> cached = cache.get(key);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            log.debug("Match cache hit for requester {}", key.getRequesterId());
        } else {
            metrics.recordCacheMiss();
        }
        return cached;
    }

    @Override
    public void cacheMatches(MatchCacheKey key, List<MatchResult> matches) {
        cache.set(key, List.copyOf(matches));
    }

    @Override
    public int clearMatches(String requesterId) {
        int removed = cache.invalidateIf(key -> key.getRequesterId().equals(requesterId));
        log.info("Cleared {} cached match lists for requester {}", removed, requesterId);
        return removed;
    }

    @Override
    public CacheStats stats() {
        return cache.stats();
    }
}
