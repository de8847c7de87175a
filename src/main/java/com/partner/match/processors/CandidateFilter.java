package com.partner.match.processors;

import com.google.common.collect.Sets;
import com.partner.match.dto.MatchingCriteria;
import com.partner.match.dto.Participant;
import com.partner.match.service.DistanceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Hard eligibility rules applied before scoring. Equivalent to the predicate the data-query
 * layer may push down, so pre-filtered pools pass through unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateFilter {
    private final DistanceProvider distanceProvider;

    public List<Participant> filter(Participant requester, Collection<Participant> pool, MatchingCriteria criteria) {
        List<Participant> eligible = pool.stream()
                .filter(Objects::nonNull)
                .filter(candidate -> isEligible(requester, candidate, criteria))
                .toList();
        log.debug("{} of {} candidates eligible for requester {}", eligible.size(), pool.size(), requester.getId());
        return eligible;
    }

    public boolean isEligible(Participant requester, Participant candidate, MatchingCriteria criteria) {
        if (candidate.getId() == null || candidate.getId().equals(requester.getId())) return false;
        if (requester.isPartneredWith(candidate.getId()) || candidate.isPartneredWith(requester.getId())) return false;
        if (!candidate.isActive() || !candidate.isProfileComplete()) return false;

        if (criteria.isRequireExactLevel() && criteria.getAcademicLevel() != null
                && criteria.getAcademicLevel() != candidate.getAcademicLevel()) {
            return false;
        }
        if (criteria.isRequireExactStyle() && criteria.getLearningStyle() != null
                && criteria.getLearningStyle() != candidate.getLearningStyle()) {
            return false;
        }
        if (!criteria.getSubjects().isEmpty()
                && Sets.intersection(criteria.getSubjects(), candidate.subjectIds()).isEmpty()) {
            return false;
        }
        return withinDistance(requester, candidate, criteria.getMaxDistance());
    }

    private boolean withinDistance(Participant requester, Participant candidate, Double maxDistance) {
        if (maxDistance == null) {
            return true;
        }
        OptionalDouble distance = distanceProvider.distanceBetween(requester, candidate);
        // unknown distance never excludes
        return distance.isEmpty() || distance.getAsDouble() <= maxDistance;
    }
}
