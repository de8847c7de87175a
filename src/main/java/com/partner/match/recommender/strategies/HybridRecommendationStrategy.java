package com.partner.match.recommender.strategies;

import com.partner.match.dto.Participant;
import com.partner.match.dto.Recommendation;
import com.partner.match.dto.enums.RecommendationMethod;
import com.partner.match.utils.AlgorithmUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blends collaborative and content-based results, each fetched at twice the requested size.
 */
@Component
@RequiredArgsConstructor
public class HybridRecommendationStrategy implements RecommendationStrategy {
    static final double COLLABORATIVE_WEIGHT = 0.6;
    static final double CONTENT_WEIGHT = 0.4;

    private final CollaborativeFilteringStrategy collaborative;
    private final ContentBasedStrategy content;

    @Override
    public List<Recommendation> recommend(Participant target, List<Participant> participants, int limit) {
        int fetch = (int) Math.min(Integer.MAX_VALUE, 2L * limit);
        Map<String, Blend> blended = new LinkedHashMap<>();
        for (Recommendation r : collaborative.recommend(target, participants, fetch)) {
            blended.computeIfAbsent(r.getParticipantId(), id -> new Blend(r.getParticipant()))
                    .add(r, COLLABORATIVE_WEIGHT);
        }
        for (Recommendation r : content.recommend(target, participants, fetch)) {
            blended.computeIfAbsent(r.getParticipantId(), id -> new Blend(r.getParticipant()))
                    .add(r, CONTENT_WEIGHT);
        }

        List<Recommendation> merged = blended.values().stream().map(Blend::toRecommendation).toList();
        List<Recommendation> ranked = AlgorithmUtils.stableSort(merged,
                Comparator.comparingDouble(Recommendation::getScore).reversed());
        return List.copyOf(ranked.subList(0, Math.min(limit, ranked.size())));
    }

    @Override
    public boolean supports(RecommendationMethod method) {
        return RecommendationMethod.HYBRID == method;
    }

    private static final class Blend {
        private final Participant participant;
        private final List<String> reasons = new ArrayList<>();
        private final List<RecommendationMethod> methods = new ArrayList<>();
        private double score;

        Blend(Participant participant) {
            this.participant = participant;
        }

        void add(Recommendation recommendation, double weight) {
            score += weight * recommendation.getScore();
            methods.add(recommendation.getMethod());
            reasons.add(recommendation.getReason());
        }

        Recommendation toRecommendation() {
            return Recommendation.builder()
                    .participant(participant)
                    .score(score)
                    .method(methods.size() > 1 ? RecommendationMethod.HYBRID : methods.get(0))
                    .reason(String.join("; ", reasons))
                    .build();
        }
    }
}
