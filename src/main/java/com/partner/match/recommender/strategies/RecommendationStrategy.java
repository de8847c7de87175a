package com.partner.match.recommender.strategies;

import com.partner.match.dto.Participant;
import com.partner.match.dto.Recommendation;
import com.partner.match.dto.enums.RecommendationMethod;

import java.util.List;

public interface RecommendationStrategy {
    List<Recommendation> recommend(Participant target, List<Participant> participants, int limit);
    boolean supports(RecommendationMethod method);
}
