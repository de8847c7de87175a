package com.partner.match.cache;

import com.partner.match.dto.MatchCacheKey;
import com.partner.match.dto.MatchResult;

import java.util.List;
import java.util.Optional;

public interface MatchCache {
    Optional<List<MatchResult>> getMatches(MatchCacheKey key);
    void cacheMatches(MatchCacheKey key, List<MatchResult> matches);
    int clearMatches(String requesterId);
    CacheStats stats();
}
