package com.partner.match.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated review data supplied by the review subsystem.
 * {@code reputation} is a weighted average already normalised into [0,1].
 */
@Value
@Builder
public class ReviewSummary {
    double reputation;
    int reviewCount;
    double averageRating;
}
