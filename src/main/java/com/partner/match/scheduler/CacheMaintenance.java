package com.partner.match.scheduler;

import com.partner.match.cache.EvictionCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Proactively sweeps expired entries so idle keys do not hold memory until their next read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheMaintenance {
    private final List<EvictionCache<?, ?>> caches;

    @Scheduled(fixedDelayString = "${matching.cache.sweep-interval-ms:60000}")
    public void sweepExpiredEntries() {
        int removed = 0;
        for (EvictionCache<?, ?> cache : caches) {
            removed += cache.evictExpired();
        }
        if (removed > 0) {
            log.info("Swept {} expired entries across {} caches", removed, caches.size());
        }
    }
}
