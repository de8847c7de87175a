package com.partner.match.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompatibilityScore {
    public static final double SUBJECT_WEIGHT = 0.25;
    public static final double LEVEL_WEIGHT = 0.20;
    public static final double STYLE_WEIGHT = 0.15;
    public static final double TIME_WEIGHT = 0.15;
    public static final double LOCATION_WEIGHT = 0.10;
    public static final double ACTIVITY_WEIGHT = 0.10;
    public static final double REPUTATION_WEIGHT = 0.05;

    double overall;
    double subjectMatch;
    double levelCompatibility;
    double styleCompatibility;
    double timeOverlap;
    double locationCompatibility;
    double activityCompatibility;
    double reputationScore;

    /**
     * Builds a score from its seven components, clamping each into [0,1] and deriving
     * {@code overall} from the fixed weights.
     */
    public static CompatibilityScore weighted(double subjectMatch, double levelCompatibility,
                                              double styleCompatibility, double timeOverlap,
                                              double locationCompatibility, double activityCompatibility,
                                              double reputationScore) {
        double subject = clamp(subjectMatch);
        double level = clamp(levelCompatibility);
        double style = clamp(styleCompatibility);
        double time = clamp(timeOverlap);
        double location = clamp(locationCompatibility);
        double activity = clamp(activityCompatibility);
        double reputation = clamp(reputationScore);

        double overall = subject * SUBJECT_WEIGHT
                + level * LEVEL_WEIGHT
                + style * STYLE_WEIGHT
                + time * TIME_WEIGHT
                + location * LOCATION_WEIGHT
                + activity * ACTIVITY_WEIGHT
                + reputation * REPUTATION_WEIGHT;

        return CompatibilityScore.builder()
                .overall(clamp(overall))
                .subjectMatch(subject)
                .levelCompatibility(level)
                .styleCompatibility(style)
                .timeOverlap(time)
                .locationCompatibility(location)
                .activityCompatibility(activity)
                .reputationScore(reputation)
                .build();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
