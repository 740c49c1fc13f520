package com.locode.resolution.cache;

import com.locode.resolution.core.model.MatchResult;
import com.locode.resolution.match.MatcherScope;
import com.locode.resolution.match.Query;

import java.util.List;
import java.util.Optional;

/**
 * Cache of ranked analyse results, keyed by scope, query and requested result count.
 */
public interface AnalysisCache {

    Optional<List<MatchResult>> get(MatcherScope scope, Query query, int matches);

    void put(MatcherScope scope, Query query, int matches, List<MatchResult> results);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates the cache described by the configuration.
     */
    static AnalysisCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineAnalysisCache(config) : new NoOpAnalysisCache();
    }
}
