package com.partner.match.dto;

import com.partner.match.dto.enums.AcademicLevel;
import com.partner.match.dto.enums.LearningStyle;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Per-request matching criteria. Level and style only act as hard filters when the
 * matching {@code requireExact*} flag is set; otherwise they only feed the cache key.
 */
@Value
@Builder(toBuilder = true)
public class MatchingCriteria {
    @Builder.Default
    Set<String> subjects = Set.of();
    AcademicLevel academicLevel;
    LearningStyle learningStyle;
    @Builder.Default
    List<AvailabilitySlot> availability = List.of();
    String location;
    MatchPreferences preferences;
    Double maxDistance;
    Double minCompatibilityScore;
    boolean requireExactLevel;
    boolean requireExactStyle;

    public static MatchingCriteria empty() {
        return MatchingCriteria.builder().build();
    }
}
