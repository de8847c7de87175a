package com.partner.match.config;

import com.partner.match.cache.EvictionCache;
import com.partner.match.dto.CompatibilityScore;
import com.partner.match.dto.ParticipantPair;
import com.partner.match.dto.ReviewSummary;
import com.partner.match.processors.CachingCompatibilityCalculator;
import com.partner.match.processors.WeightedCompatibilityCalculator;
import com.partner.match.service.CompatibilityCalculator;
import com.partner.match.service.DistanceProvider;
import com.partner.match.service.ReputationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.OptionalDouble;

@Slf4j
@Configuration
public class MatchingConfig {

    /**
     * Fallback used until the review subsystem supplies real aggregates.
     */
    @Bean
    @ConditionalOnMissingBean
    public ReputationProvider reputationProvider(@Value("${matching.reputation.default:0.8}") double defaultReputation) {
        log.info("No review aggregator configured; using constant reputation {}", defaultReputation);
        ReviewSummary summary = ReviewSummary.builder().reputation(defaultReputation).build();
        return participant -> summary;
    }

    /**
     * Fallback used until a geocoding service is wired in; every distance is unknown.
     */
    @Bean
    @ConditionalOnMissingBean
    public DistanceProvider distanceProvider() {
        return (left, right) -> OptionalDouble.empty();
    }

    @Bean
    public WeightedCompatibilityCalculator weightedCompatibilityCalculator(
            ReputationProvider reputationProvider, DistanceProvider distanceProvider) {
        return new WeightedCompatibilityCalculator(reputationProvider, distanceProvider);
    }

    @Bean
    @Primary
    public CompatibilityCalculator compatibilityCalculator(
            WeightedCompatibilityCalculator delegate,
            @Qualifier("scoreCache") EvictionCache<ParticipantPair, CompatibilityScore> scoreCache) {
        return new CachingCompatibilityCalculator(delegate, scoreCache);
    }
}
