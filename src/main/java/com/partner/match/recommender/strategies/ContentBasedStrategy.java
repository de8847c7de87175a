package com.partner.match.recommender.strategies;

import com.partner.match.dto.Participant;
import com.partner.match.dto.Recommendation;
import com.partner.match.dto.SubjectProficiency;
import com.partner.match.dto.enums.AcademicLevel;
import com.partner.match.dto.enums.RecommendationMethod;
import com.partner.match.utils.AlgorithmUtils;
import com.partner.match.utils.SimilarityUtils;
import com.google.common.collect.Sets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks participants by cosine similarity of sparse profile feature vectors.
 */
@Slf4j
@Component
public class ContentBasedStrategy implements RecommendationStrategy {
    private static final double CATEGORICAL_WEIGHT = 1.0;

    @Override
    public List<Recommendation> recommend(Participant target, List<Participant> participants, int limit) {
        Map<String, Double> targetFeatures = features(target);

        List<Recommendation> scored = new ArrayList<>();
        for (Participant candidate : participants) {
            if (candidate == null || candidate.getId() == null || !isRecommendable(target, candidate)) {
                continue;
            }
            double score = SimilarityUtils.cosine(targetFeatures, features(candidate));
            scored.add(Recommendation.builder()
                    .participant(candidate)
                    .score(score)
                    .method(RecommendationMethod.CONTENT)
                    .reason(reason(target, candidate))
                    .build());
        }
        log.debug("Scored {} content candidates for {}", scored.size(), target.getId());
        return AlgorithmUtils.topK(scored, Recommendation::getScore, limit);
    }

    @Override
    public boolean supports(RecommendationMethod method) {
        return RecommendationMethod.CONTENT == method;
    }

    static Map<String, Double> features(Participant participant) {
        Map<String, Double> features = new HashMap<>();
        for (SubjectProficiency subject : participant.getSubjects()) {
            features.put("subject_" + subject.getSubjectId(), (double) subject.getProficiencyLevel().rating());
        }
        features.put("level_" + AcademicLevel.orDefault(participant.getAcademicLevel()).name(), CATEGORICAL_WEIGHT);
        if (participant.getLearningStyle() != null) {
            features.put("style_" + participant.getLearningStyle().name(), CATEGORICAL_WEIGHT);
        }
        if (participant.getInstitution() != null) {
            features.put("institution_" + participant.getInstitution(), CATEGORICAL_WEIGHT);
        }
        if (participant.getMajor() != null) {
            features.put("major_" + participant.getMajor(), CATEGORICAL_WEIGHT);
        }
        if (participant.getGraduationYear() != null) {
            features.put("year_" + participant.getGraduationYear(), CATEGORICAL_WEIGHT);
        }
        return features;
    }

    static String reason(Participant target, Participant candidate) {
        List<String> reasons = new ArrayList<>();
        int shared = Sets.intersection(target.subjectIds(), candidate.subjectIds()).size();
        if (shared > 0) {
            reasons.add(shared + " shared subject" + (shared == 1 ? "" : "s"));
        }
        if (AcademicLevel.orDefault(target.getAcademicLevel()) == AcademicLevel.orDefault(candidate.getAcademicLevel())) {
            reasons.add("Same academic level");
        }
        if (target.getLearningStyle() != null && target.getLearningStyle() == candidate.getLearningStyle()) {
            reasons.add("Same learning style");
        }
        if (target.getInstitution() != null && Objects.equals(target.getInstitution(), candidate.getInstitution())) {
            reasons.add("Same institution");
        }
        return reasons.isEmpty() ? "Good overall match" : "High compatibility: " + String.join(", ", reasons);
    }

    private static boolean isRecommendable(Participant target, Participant candidate) {
        return !candidate.getId().equals(target.getId())
                && !target.isPartneredWith(candidate.getId())
                && !candidate.isPartneredWith(target.getId());
    }
}
