package com.locode.resolution.cache;

import com.locode.resolution.core.model.MatchResult;
import com.locode.resolution.match.MatcherScope;
import com.locode.resolution.match.Query;

import java.util.List;
import java.util.Optional;

/**
 * Analysis cache that stores nothing.
 */
public class NoOpAnalysisCache implements AnalysisCache {

    @Override
    public Optional<List<MatchResult>> get(MatcherScope scope, Query query, int matches) {
        return Optional.empty();
    }

    @Override
    public void put(MatcherScope scope, Query query, int matches, List<MatchResult> results) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
