package com.partner.match.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MatchStats {
    int totalPartnerships;
    int reviewCount;
    int recentActivity;
    double averageRating;
}
