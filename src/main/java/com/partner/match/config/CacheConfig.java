package com.partner.match.config;

import com.partner.match.cache.EvictionCache;
import com.partner.match.cache.ValueEvictionCache;
import com.partner.match.dto.CompatibilityScore;
import com.partner.match.dto.MatchCacheKey;
import com.partner.match.dto.MatchResult;
import com.partner.match.dto.ParticipantPair;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "matchResultCache")
    public EvictionCache<MatchCacheKey, List<MatchResult>> matchResultCache(
            @Value("${matching.cache.capacity:1000}") int capacity,
            @Value("${matching.cache.ttl-seconds:300}") long ttlSeconds,
            Clock clock) {
        return new ValueEvictionCache<>("matchResults", capacity, Duration.ofSeconds(ttlSeconds), clock);
    }

    @Bean(name = "scoreCache")
    public EvictionCache<ParticipantPair, CompatibilityScore> scoreCache(
            @Value("${matching.score-cache.capacity:10000}") int capacity,
            @Value("${matching.score-cache.ttl-seconds:300}") long ttlSeconds,
            Clock clock) {
        return new ValueEvictionCache<>("compatibilityScores", capacity, Duration.ofSeconds(ttlSeconds), clock);
    }
}
