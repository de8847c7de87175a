package com.partner.match.processors;

import com.partner.match.dto.CompatibilityScore;
import com.partner.match.dto.MatchResult;
import com.partner.match.dto.MatchStats;
import com.partner.match.dto.Participant;
import com.partner.match.dto.ReviewSummary;
import com.partner.match.dto.enums.AcademicLevel;
import com.partner.match.service.ReputationProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class MatchResultFactory {
    private static final double STRONG_COMPONENT = 0.7;

    private final ReputationProvider reputationProvider;

    public MatchResult create(Participant requester, Participant candidate, CompatibilityScore score) {
        List<String> shared = sharedSubjects(requester, candidate);
        ReviewSummary reviews = Optional.ofNullable(reputationProvider.summarize(candidate))
                .orElse(ReviewSummary.builder().build());

        return MatchResult.builder()
                .participant(candidate)
                .compatibilityScore(score)
                .sharedSubjects(shared)
                .complementarySkills(complementarySkills(requester, candidate, shared))
                .reasons(reasons(score, shared))
                .stats(MatchStats.builder()
                        .totalPartnerships(candidate.getPartnerIds().size())
                        .recentActivity(candidate.getRecentActivity())
                        .reviewCount(reviews.getReviewCount())
                        .averageRating(reviews.getAverageRating())
                        .build())
                .build();
    }

    private static List<String> sharedSubjects(Participant requester, Participant candidate) {
        Set<String> candidateSubjects = candidate.subjectIds();
        return requester.subjectIds().stream()
                .filter(candidateSubjects::contains)
                .toList();
    }

    /**
     * Shared subjects in which the candidate is more proficient than the requester.
     */
    private static List<String> complementarySkills(Participant requester, Participant candidate, List<String> shared) {
        List<String> skills = new ArrayList<>();
        for (String subjectId : shared) {
            int own = requester.proficiencyIn(subjectId).map(AcademicLevel::rating).orElse(0);
            int theirs = candidate.proficiencyIn(subjectId).map(AcademicLevel::rating).orElse(0);
            if (theirs > own) {
                skills.add(subjectId);
            }
        }
        return skills;
    }

    private static List<String> reasons(CompatibilityScore score, List<String> shared) {
        List<String> reasons = new ArrayList<>();
        if (!shared.isEmpty()) {
            reasons.add(shared.size() + (shared.size() == 1 ? " shared subject" : " shared subjects"));
        }
        if (score.getLevelCompatibility() == 1.0) {
            reasons.add("Same academic level");
        }
        if (score.getStyleCompatibility() >= STRONG_COMPONENT) {
            reasons.add("Compatible learning styles");
        }
        if (score.getTimeOverlap() >= STRONG_COMPONENT) {
            reasons.add("Largely overlapping availability");
        }
        if (score.getLocationCompatibility() == 1.0) {
            reasons.add("Same timezone or region");
        }
        if (score.getActivityCompatibility() >= STRONG_COMPONENT) {
            reasons.add("Similar study activity");
        }
        return reasons;
    }
}
