package com.partner.match.processors;

import com.partner.match.dto.CompatibilityScore;
import com.partner.match.dto.Participant;
import com.partner.match.dto.TimeInterval;
import com.partner.match.dto.enums.AcademicLevel;
import com.partner.match.dto.enums.LearningStyle;
import com.partner.match.service.CompatibilityCalculator;
import com.partner.match.service.DistanceProvider;
import com.partner.match.service.ReputationProvider;
import com.partner.match.utils.SimilarityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;


/**
 * Seven-factor compatibility between a requester and a candidate. Pure apart from the two
 * collaborators, which are consulted for the candidate's reputation and the pair's distance.
 */
@Slf4j
@RequiredArgsConstructor
public class WeightedCompatibilityCalculator implements CompatibilityCalculator {
    private static final double NEUTRAL_SCORE = 0.5;
    private static final double COMPLEMENTARY_STYLE_SCORE = 0.8;
    private static final double DIFFERENT_STYLE_SCORE = 0.3;
    private static final List<Set<LearningStyle>> COMPLEMENTARY_STYLES = List.of(
            EnumSet.of(LearningStyle.VISUAL, LearningStyle.KINESTHETIC),
            EnumSet.of(LearningStyle.AUDITORY, LearningStyle.READING),
            EnumSet.of(LearningStyle.VISUAL, LearningStyle.AUDITORY)
    );

    private final ReputationProvider reputationProvider;
    private final DistanceProvider distanceProvider;

    @Override
    public CompatibilityScore calculate(Participant requester, Participant candidate) {
        CompatibilityScore score = CompatibilityScore.weighted(
                subjectMatch(requester, candidate),
                levelCompatibility(requester.getAcademicLevel(), candidate.getAcademicLevel()),
                styleCompatibility(requester.getLearningStyle(), candidate.getLearningStyle()),
                timeOverlap(requester.getAvailability(), candidate.getAvailability()),
                locationCompatibility(requester, candidate),
                activityCompatibility(requester.getRecentActivity(), candidate.getRecentActivity()),
                reputationProvider.reputationOf(candidate)
        );
        log.debug("Scored {} against {}: overall={}", requester.getId(), candidate.getId(), score.getOverall());
        return score;
    }

    static double subjectMatch(Participant left, Participant right) {
        return SimilarityUtils.jaccard(left.subjectIds(), right.subjectIds());
    }

    static double levelCompatibility(AcademicLevel left, AcademicLevel right) {
        int difference = Math.abs(AcademicLevel.orDefault(left).ordinal() - AcademicLevel.orDefault(right).ordinal());
        return switch (difference) {
            case 0 -> 1.0;
            case 1 -> 0.8;
            case 2 -> 0.5;
            default -> 0.2;
        };
    }

    static double styleCompatibility(LearningStyle left, LearningStyle right) {
        if (left == null || right == null) return NEUTRAL_SCORE;
        if (left == right) return 1.0;

        Set<LearningStyle> pair = EnumSet.of(left, right);
        return COMPLEMENTARY_STYLES.contains(pair) ? COMPLEMENTARY_STYLE_SCORE : DIFFERENT_STYLE_SCORE;
    }

    /**
     * Two-pointer sweep over both availability lists sorted by start. The accumulated
     * intersection is divided by the smaller of the two total durations.
     */
    static double timeOverlap(List<TimeInterval> left, List<TimeInterval> right) {
        List<TimeInterval> first = usable(left);
        List<TimeInterval> second = usable(right);
        long totalFirst = first.stream().mapToLong(TimeInterval::durationMillis).sum();
        long totalSecond = second.stream().mapToLong(TimeInterval::durationMillis).sum();
        if (totalFirst == 0 || totalSecond == 0) {
            return 0.0;
        }

        long overlap = 0;
        int i = 0, j = 0;
        while (i < first.size() && j < second.size()) {
            TimeInterval a = first.get(i);
            TimeInterval b = second.get(j);

            long start = Math.max(a.getStart().toEpochMilli(), b.getStart().toEpochMilli());
            long end = Math.min(a.getEnd().toEpochMilli(), b.getEnd().toEpochMilli());
            if (start < end) {
                overlap += end - start;
            }

            if (a.getEnd().isBefore(b.getEnd())) {
                i++;
            } else {
                j++;
            }
        }

        return Math.min(1.0, (double) overlap / Math.min(totalFirst, totalSecond));
    }

    double locationCompatibility(Participant left, Participant right) {
        boolean leftTagged = left.getTimezone() != null || left.getRegion() != null;
        boolean rightTagged = right.getTimezone() != null || right.getRegion() != null;
        if (!leftTagged || !rightTagged) {
            return NEUTRAL_SCORE;
        }
        if (sameTag(left.getTimezone(), right.getTimezone()) || sameTag(left.getRegion(), right.getRegion())) {
            return 1.0;
        }

        OptionalDouble distance = distanceProvider.distanceBetween(left, right);
        if (distance.isEmpty()) {
            log.debug("No distance available between {} and {}", left.getId(), right.getId());
            return NEUTRAL_SCORE;
        }
        return scoreForDistance(distance.getAsDouble());
    }

    public static double scoreForDistance(double distance) {
        if (distance < 10) return 0.9;
        if (distance < 50) return 0.7;
        if (distance < 200) return 0.4;
        return 0.1;
    }

    static double activityCompatibility(int left, int right) {
        int a = Math.max(0, left);
        int b = Math.max(0, right);
        int max = Math.max(a, b);
        if (max == 0) return NEUTRAL_SCORE;
        return Math.max(0.0, 1.0 - (double) Math.abs(a - b) / max);
    }

    private static boolean sameTag(String left, String right) {
        return left != null && right != null && left.trim().equalsIgnoreCase(right.trim());
    }

    private static List<TimeInterval> usable(List<TimeInterval> intervals) {
        if (intervals == null) return List.of();
        return intervals.stream()
                .filter(interval -> !interval.isDegenerate())
                .sorted(Comparator.comparing(TimeInterval::getStart))
                .toList();
    }
}
