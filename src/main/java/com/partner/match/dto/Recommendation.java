package com.partner.match.dto;

import com.partner.match.dto.enums.RecommendationMethod;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Recommendation {
    Participant participant;
    double score;
    RecommendationMethod method;
    String reason;

    public String getParticipantId() {
        return participant.getId();
    }
}
