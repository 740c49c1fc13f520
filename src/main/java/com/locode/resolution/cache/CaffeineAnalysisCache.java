package com.locode.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.locode.resolution.core.model.MatchResult;
import com.locode.resolution.match.MatcherScope;
import com.locode.resolution.match.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Caffeine-backed analysis cache bounded by entry count.
 */
public class CaffeineAnalysisCache implements AnalysisCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineAnalysisCache.class);

    private final Cache<CacheKey, List<MatchResult>> cache;

    public CaffeineAnalysisCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("CaffeineAnalysisCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public Optional<List<MatchResult>> get(MatcherScope scope, Query query, int matches) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(scope, query, matches)));
    }

    @Override
    public void put(MatcherScope scope, Query query, int matches, List<MatchResult> results) {
        cache.put(new CacheKey(scope, query, matches), List.copyOf(results));
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all analysis cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), cache.estimatedSize());
    }

    record CacheKey(MatcherScope scope, Query query, int matches) {}
}
