package com.partner.match.dto;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class TimeInterval {
    Instant start;
    Instant end;
    String participantId;

    public boolean isDegenerate() {
        return start == null || end == null || !start.isBefore(end);
    }

    public long durationMillis() {
        return isDegenerate() ? 0L : Duration.between(start, end).toMillis();
    }

    /**
     * Half-open overlap test; intervals that only touch at an endpoint do not overlap.
     */
    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }
}
