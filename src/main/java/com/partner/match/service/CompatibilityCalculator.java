package com.partner.match.service;

import com.partner.match.dto.CompatibilityScore;
import com.partner.match.dto.Participant;

public interface CompatibilityCalculator {
    CompatibilityScore calculate(Participant requester, Participant candidate);
}
