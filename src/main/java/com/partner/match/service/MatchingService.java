package com.partner.match.service;

import com.partner.match.dto.MatchResult;
import com.partner.match.dto.MatchingCriteria;
import com.partner.match.dto.Participant;

import java.util.Collection;
import java.util.List;

public interface MatchingService {
    List<MatchResult> findMatches(Participant requester, Collection<Participant> candidatePool,
                                  MatchingCriteria criteria, int limit);
    int invalidate(String requesterId);
}
