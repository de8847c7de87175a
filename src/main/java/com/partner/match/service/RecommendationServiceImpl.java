package com.partner.match.service;

import com.partner.match.dto.Participant;
import com.partner.match.dto.Recommendation;
import com.partner.match.dto.enums.RecommendationMethod;
import com.partner.match.metrics.MatchingMetrics;
import com.partner.match.recommender.strategies.RecommendationStrategyContext;
import com.partner.match.validation.RequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationServiceImpl implements RecommendationService {
    private final RecommendationStrategyContext strategyContext;
    private final MatchingMetrics metrics;

    @Override
    public List<Recommendation> recommend(Participant target, List<Participant> participants,
                                          RecommendationMethod method, int limit) {
        RequestValidator.requireParticipant(target, "target");
        RequestValidator.requirePositiveLimit(limit);
        RequestValidator.requireMethod(method);
        if (participants == null || participants.isEmpty()) {
            return List.of();
        }

        List<Recommendation> recommendations = strategyContext.resolve(method).recommend(target, participants, limit);
        metrics.recordRecommendations(method, recommendations.size());
        log.info("Generated {} {} recommendations for {}", recommendations.size(), method, target.getId());
        return recommendations;
    }
}
