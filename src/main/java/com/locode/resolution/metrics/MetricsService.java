package com.locode.resolution.metrics;

import com.locode.resolution.match.MatcherScope;

import java.time.Duration;

/**
 * Interface for recording matching metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    void recordAnalyseDuration(MatcherScope scope, Duration duration);

    void recordBestScore(double score);

    void incrementNoMatch(MatcherScope scope);

    void recordCacheHit();

    void recordCacheMiss();

    void recordOrphans(int count);

    void incrementNearestSearch(boolean found);
}
