package com.partner.match.dto;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Value
public class ScheduleSlot {
    Instant start;
    Instant end;
    List<String> participantIds;

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }
}
