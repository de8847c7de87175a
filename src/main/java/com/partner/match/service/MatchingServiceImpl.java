package com.partner.match.service;

import com.partner.match.cache.MatchCache;
import com.partner.match.dto.CompatibilityScore;
import com.partner.match.dto.MatchCacheKey;
import com.partner.match.dto.MatchResult;
import com.partner.match.dto.MatchingCriteria;
import com.partner.match.dto.Participant;
import com.partner.match.metrics.MatchingMetrics;
import com.partner.match.processors.CandidateFilter;
import com.partner.match.processors.DiversityFilter;
import com.partner.match.processors.MatchRanker;
import com.partner.match.processors.MatchResultFactory;
import com.partner.match.validation.RequestValidator;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingServiceImpl implements MatchingService {
    private final CandidateFilter candidateFilter;
    private final CompatibilityCalculator compatibilityCalculator;
    private final MatchRanker matchRanker;
    private final DiversityFilter diversityFilter;
    private final MatchResultFactory matchResultFactory;
    private final MatchCache matchCache;
    private final MatchingMetrics metrics;

    @Override
    public List<MatchResult> findMatches(Participant requester, Collection<Participant> candidatePool,
                                         MatchingCriteria criteria, int limit) {
        RequestValidator.requireParticipant(requester, "requester");
        RequestValidator.requirePositiveLimit(limit);
        MatchCacheKey cacheKey = MatchCacheKey.of(requester.getId(), criteria != null ? criteria : MatchingCriteria.empty());
        MatchingCriteria effectiveCriteria = cacheKey.getCriteria();
        Optional<List<MatchResult>> cached = matchCache.getMatches(cacheKey);
        if (cached.isPresent()) {
            return truncate(cached.get(), limit);
        }

        Timer.Sample sample = metrics.startTimer();
        Collection<Participant> pool = candidatePool != null ? candidatePool : List.of();
        List<Participant> eligible = candidateFilter.filter(requester, pool, effectiveCriteria);
        metrics.recordCandidates(pool.size(), eligible.size());

        List<MatchResult> scored = score(requester, eligible, effectiveCriteria);
        List<MatchResult> diversified = diversityFilter.diversify(matchRanker.rank(scored));
        matchCache.cacheMatches(cacheKey, diversified);

        List<MatchResult> result = truncate(diversified, limit);
        metrics.recordMatchingDuration(sample, result.size());
        log.info("Matched requester {}: pool={}, eligible={}, returned={}",
                requester.getId(), pool.size(), eligible.size(), result.size());
        return result;
    }

    @Override
    public int invalidate(String requesterId) {
        return matchCache.clearMatches(requesterId);
    }

    private List<MatchResult> score(Participant requester, List<Participant> candidates, MatchingCriteria criteria) {
        Double minimum = criteria.getMinCompatibilityScore();
        List<MatchResult> scored = new ArrayList<>(candidates.size());
        for (Participant candidate : candidates) {
            CompatibilityScore score = compatibilityCalculator.calculate(requester, candidate);
            if (minimum != null && score.getOverall() < minimum) {
                log.debug("Dropping candidate {} below minimum score {}: {}", candidate.getId(), minimum, score.getOverall());
                continue;
            }
            metrics.recordOverallScore(score.getOverall());
            scored.add(matchResultFactory.create(requester, candidate, score));
        }
        return scored;
    }

    private static List<MatchResult> truncate(List<MatchResult> matches, int limit) {
        return List.copyOf(matches.subList(0, Math.min(limit, matches.size())));
    }
}
