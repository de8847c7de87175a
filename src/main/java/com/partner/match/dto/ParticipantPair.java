package com.partner.match.dto;

import lombok.Value;

/**
 * Ordered pair of participant snapshots. Keys on full values so an edited profile
 * never hits a score computed for its previous state.
 */
@Value
public class ParticipantPair {
    Participant first;
    Participant second;
}
