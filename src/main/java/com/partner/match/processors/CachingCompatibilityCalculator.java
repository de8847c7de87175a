package com.partner.match.processors;

import com.partner.match.cache.EvictionCache;
import com.partner.match.dto.CompatibilityScore;
import com.partner.match.dto.Participant;
import com.partner.match.dto.ParticipantPair;
import com.partner.match.service.CompatibilityCalculator;
import lombok.RequiredArgsConstructor;

/**
 * Memoizes another calculator per ordered participant pair.
 */
@RequiredArgsConstructor
public class CachingCompatibilityCalculator implements CompatibilityCalculator {
    private final CompatibilityCalculator delegate;
    private final EvictionCache<ParticipantPair, CompatibilityScore> cache;

    @Override
    public CompatibilityScore calculate(Participant requester, Participant candidate) {
        return cache.getOrCompute(new ParticipantPair(requester, candidate),
                pair -> delegate.calculate(pair.getFirst(), pair.getSecond()));
    }
}
