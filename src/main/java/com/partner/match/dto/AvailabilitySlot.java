package com.partner.match.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Raw weekly availability tuple as stored by the surrounding system.
 * {@code day} is a weekday name or an ISO date; {@code startTime} and {@code endTime}
 * are either local times or full ISO date-times.
 */
@Value
@Builder
@Jacksonized
public class AvailabilitySlot {
    String day;
    String startTime;
    String endTime;
    String timezone;
}
