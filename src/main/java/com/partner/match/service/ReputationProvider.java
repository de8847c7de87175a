package com.partner.match.service;

import com.partner.match.dto.Participant;
import com.partner.match.dto.ReviewSummary;

/**
 * Review-aggregation collaborator. The engine treats its output as opaque input.
 */
@FunctionalInterface
public interface ReputationProvider {
    ReviewSummary summarize(Participant participant);

    default double reputationOf(Participant participant) {
        ReviewSummary summary = summarize(participant);
        return summary != null ? summary.getReputation() : 0.0;
    }
}
