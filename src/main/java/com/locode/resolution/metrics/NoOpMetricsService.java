package com.locode.resolution.metrics;

import com.locode.resolution.match.MatcherScope;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAnalyseDuration(MatcherScope scope, Duration duration) {
    }

    @Override
    public void recordBestScore(double score) {
    }

    @Override
    public void incrementNoMatch(MatcherScope scope) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordOrphans(int count) {
    }

    @Override
    public void incrementNearestSearch(boolean found) {
    }
}
