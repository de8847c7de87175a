package com.partner.match.validation;

import com.partner.match.dto.Participant;
import com.partner.match.dto.enums.RecommendationMethod;
import com.partner.match.exceptions.InvalidRequestException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UtilityClass
public final class RequestValidator {

    public static void requireParticipant(Participant participant, String role) {
        if (participant == null || participant.getId() == null) {
            throw reject("A " + role + " with an id is required");
        }
    }

    public static void requirePositiveLimit(int limit) {
        if (limit <= 0) {
            throw reject("limit must be positive but was " + limit);
        }
    }

    public static void requirePositiveDuration(long requiredDurationMinutes) {
        if (requiredDurationMinutes <= 0) {
            throw reject("requiredDurationMinutes must be positive but was " + requiredDurationMinutes);
        }
    }

    public static void requireMethod(RecommendationMethod method) {
        if (method == null) {
            throw reject("A recommendation method is required");
        }
    }

    private static InvalidRequestException reject(String message) {
        log.warn("Rejected engine call: {}", message);
        return new InvalidRequestException(message);
    }
}
