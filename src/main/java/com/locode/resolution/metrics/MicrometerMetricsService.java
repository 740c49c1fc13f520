package com.locode.resolution.metrics;

import com.locode.resolution.match.MatcherScope;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code locode.analyse.duration} - Timer (tag: scope)</li>
 *   <li>{@code locode.analyse.nomatch} - Counter (tag: scope)</li>
 *   <li>{@code locode.match.score} - DistributionSummary of best scores</li>
 *   <li>{@code locode.cache.hit} / {@code locode.cache.miss} - Counters</li>
 *   <li>{@code locode.consistency.orphans} - DistributionSummary</li>
 *   <li>{@code locode.nearest.search} - Counter (tag: found)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary bestScoreSummary;
    private final DistributionSummary orphanSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.bestScoreSummary = DistributionSummary.builder("locode.match.score")
                .description("Distribution of best match scores")
                .register(registry);
        this.orphanSummary = DistributionSummary.builder("locode.consistency.orphans")
                .description("Orphaned subdivision references found per consistency check")
                .register(registry);
        this.cacheHitCounter = Counter.builder("locode.cache.hit")
                .description("Number of analysis cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("locode.cache.miss")
                .description("Number of analysis cache misses")
                .register(registry);
    }

    @Override
    public void recordAnalyseDuration(MatcherScope scope, Duration duration) {
        String label = scope.label();
        Timer timer = timerCache.computeIfAbsent(label, k ->
                Timer.builder("locode.analyse.duration")
                        .description("Duration of catalog analyse operations")
                        .tag("scope", label)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordBestScore(double score) {
        bestScoreSummary.record(score);
    }

    @Override
    public void incrementNoMatch(MatcherScope scope) {
        counter("nomatch:" + scope.label(), "locode.analyse.nomatch",
                "Number of queries without any candidate", "scope", scope.label()).increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordOrphans(int count) {
        orphanSummary.record(count);
    }

    @Override
    public void incrementNearestSearch(boolean found) {
        String value = String.valueOf(found);
        counter("nearest:" + value, "locode.nearest.search",
                "Number of nearest-point searches", "found", value).increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
