package com.partner.match.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MatchResult {
    Participant participant;
    CompatibilityScore compatibilityScore;
    @Builder.Default
    List<String> reasons = List.of();
    @Builder.Default
    List<String> sharedSubjects = List.of();
    @Builder.Default
    List<String> complementarySkills = List.of();
    MatchStats stats;

    public String getParticipantId() {
        return participant.getId();
    }
}
