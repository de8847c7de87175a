package com.partner.match.recommender.strategies;

import com.partner.match.dto.enums.RecommendationMethod;
import com.partner.match.exceptions.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RecommendationStrategyContext {
    private final List<RecommendationStrategy> strategies;

    public RecommendationStrategy resolve(RecommendationMethod method) {
        return strategies.stream()
                .filter(strategy -> strategy.supports(method))
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException("Unsupported recommendation method: " + method));
    }
}
