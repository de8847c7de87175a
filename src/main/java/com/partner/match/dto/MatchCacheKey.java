package com.partner.match.dto;

import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result-cache key. Holds an immutable snapshot of the criteria so later changes to the
 * caller's collections cannot alter the key's hash while it is cached.
 */
@Value
public class MatchCacheKey {
    String requesterId;
    MatchingCriteria criteria;

    public static MatchCacheKey of(String requesterId, MatchingCriteria criteria) {
        Set<String> subjects = criteria.getSubjects() == null ? Set.of() : criteria.getSubjects().stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
        List<AvailabilitySlot> availability = criteria.getAvailability() == null ? List.of() : criteria.getAvailability().stream()
                .filter(Objects::nonNull)
                .toList();
        return new MatchCacheKey(requesterId, criteria.toBuilder()
                .subjects(subjects)
                .availability(availability)
                .build());
    }
}
