package com.partner.match.recommender.strategies;

import com.partner.match.dto.Participant;
import com.partner.match.dto.Recommendation;
import com.partner.match.dto.SubjectProficiency;
import com.partner.match.dto.enums.RecommendationMethod;
import com.partner.match.models.ParticipantGraph;
import com.partner.match.utils.AlgorithmUtils;
import com.partner.match.utils.SimilarityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * User-based collaborative filtering. Participants whose subject proficiencies correlate with the
 * target's vouch for their own partners.
 */
@Slf4j
@Component
public class CollaborativeFilteringStrategy implements RecommendationStrategy {
    static final double MIN_NEIGHBOR_SIMILARITY = 0.3;
    static final int MAX_NEIGHBORS = 20;
    static final int MIN_SHARED_SUBJECTS = 2;

    @Override
    public List<Recommendation> recommend(Participant target, List<Participant> participants, int limit) {
        Map<String, Participant> pool = participants.stream()
                .filter(Objects::nonNull)
                .filter(p -> p.getId() != null)
                .collect(Collectors.toMap(Participant::getId, Function.identity(), (first, second) -> first, LinkedHashMap::new));

        List<Neighbor> candidates = new ArrayList<>();
        for (Participant other : pool.values()) {
            if (other.getId().equals(target.getId())) {
                continue;
            }
            double similarity = similarity(target, other);
            if (similarity > MIN_NEIGHBOR_SIMILARITY) {
                candidates.add(new Neighbor(other.getId(), similarity));
            }
        }
        List<Neighbor> neighbors = AlgorithmUtils.topK(candidates, Neighbor::similarity, MAX_NEIGHBORS);
        if (neighbors.isEmpty()) {
            log.debug("No similar participants for {}", target.getId());
            return List.of();
        }

        ParticipantGraph graph = ParticipantGraph.fromPartnerships(pool.values());
        graph.addPartnerships(target);
        Map<String, Endorsement> endorsements = new LinkedHashMap<>();
        for (Neighbor neighbor : neighbors) {
            for (String partnerId : graph.getNeighbors(neighbor.id())) {
                Participant candidate = pool.get(partnerId);
                if (candidate == null || !isRecommendable(graph, target, candidate)) {
                    continue;
                }
                endorsements.computeIfAbsent(partnerId, id -> new Endorsement(candidate))
                        .add(neighbor.similarity());
            }
        }

        List<Recommendation> recommendations = endorsements.values().stream()
                .map(Endorsement::toRecommendation)
                .toList();
        List<Recommendation> ranked = AlgorithmUtils.stableSort(recommendations,
                Comparator.comparingDouble(Recommendation::getScore).reversed());
        return List.copyOf(ranked.subList(0, Math.min(limit, ranked.size())));
    }

    @Override
    public boolean supports(RecommendationMethod method) {
        return RecommendationMethod.COLLABORATIVE == method;
    }

    /**
     * Pearson correlation of proficiency ratings over shared subjects, or 0 with fewer than two.
     */
    static double similarity(Participant left, Participant right) {
        Map<String, Integer> rightRatings = new LinkedHashMap<>();
        for (SubjectProficiency subject : right.getSubjects()) {
            rightRatings.putIfAbsent(subject.getSubjectId(), subject.getProficiencyLevel().rating());
        }
        List<double[]> pairs = new ArrayList<>();
        for (String subjectId : left.subjectIds()) {
            Integer rightRating = rightRatings.get(subjectId);
            if (rightRating != null) {
                double leftRating = left.proficiencyIn(subjectId).orElseThrow().rating();
                pairs.add(new double[]{leftRating, rightRating});
            }
        }
        if (pairs.size() < MIN_SHARED_SUBJECTS) {
            return 0.0;
        }
        double[] x = new double[pairs.size()];
        double[] y = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        return SimilarityUtils.pearson(x, y);
    }

    private static boolean isRecommendable(ParticipantGraph graph, Participant target, Participant candidate) {
        return !candidate.getId().equals(target.getId())
                && !graph.hasEdge(target.getId(), candidate.getId());
    }

    private record Neighbor(String id, double similarity) {
    }

    private static final class Endorsement {
        private final Participant participant;
        private double totalSimilarity;
        private int endorsers;

        Endorsement(Participant participant) {
            this.participant = participant;
        }

        void add(double similarity) {
            totalSimilarity += similarity;
            endorsers++;
        }

        Recommendation toRecommendation() {
            String reason = String.format(Locale.ROOT, "Recommended by %d participant%s similar to you (similarity: %.2f)",
                    endorsers, endorsers == 1 ? "" : "s", totalSimilarity / endorsers);
            return Recommendation.builder()
                    .participant(participant)
                    .score(totalSimilarity)
                    .method(RecommendationMethod.COLLABORATIVE)
                    .reason(reason)
                    .build();
        }
    }
}
