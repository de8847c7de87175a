package com.partner.match.scheduler;

import com.partner.match.cache.EvictionCache;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CacheMaintenanceTest {

    @Test
    void shouldSweepEveryCache() {
        EvictionCache<?, ?> first = mock(EvictionCache.class);
        EvictionCache<?, ?> second = mock(EvictionCache.class);
        when(first.evictExpired()).thenReturn(2);
        when(second.evictExpired()).thenReturn(0);

        new CacheMaintenance(List.of(first, second)).sweepExpiredEntries();

        verify(first).evictExpired();
        verify(second).evictExpired();
    }
}
