package com.partner.match.processors;

import com.partner.match.dto.CompatibilityScore;
import com.partner.match.dto.MatchResult;
import com.partner.match.utils.AlgorithmUtils;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Orders scored candidates by overall score, treating scores within
 * {@value #OVERALL_TOLERANCE} as tied and falling back to subject match, then time overlap.
 */
@Component
public class MatchRanker {
    static final double OVERALL_TOLERANCE = 0.1;
    static final double SUBJECT_TOLERANCE = 0.05;

    public static final Comparator<CompatibilityScore> RANKING_ORDER = (a, b) -> {
        if (Math.abs(a.getOverall() - b.getOverall()) > OVERALL_TOLERANCE) {
            return Double.compare(b.getOverall(), a.getOverall());
        }
        if (Math.abs(a.getSubjectMatch() - b.getSubjectMatch()) > SUBJECT_TOLERANCE) {
            return Double.compare(b.getSubjectMatch(), a.getSubjectMatch());
        }
        return Double.compare(b.getTimeOverlap(), a.getTimeOverlap());
    };

    public List<MatchResult> rank(List<MatchResult> scored) {
        return AlgorithmUtils.stableSort(scored,
                (left, right) -> RANKING_ORDER.compare(left.getCompatibilityScore(), right.getCompatibilityScore()));
    }
}
