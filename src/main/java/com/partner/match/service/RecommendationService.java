package com.partner.match.service;

import com.partner.match.dto.Participant;
import com.partner.match.dto.Recommendation;
import com.partner.match.dto.enums.RecommendationMethod;

import java.util.List;

public interface RecommendationService {
    List<Recommendation> recommend(Participant target, List<Participant> participants,
                                   RecommendationMethod method, int limit);
}
