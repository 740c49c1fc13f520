package com.locode.resolution.match;

import com.locode.resolution.catalog.InMemoryCodeBank;
import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.metrics.MetricsService;
import com.locode.resolution.testutil.CatalogFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CodeMatcher metrics")
class CodeMatcherMetricsTest {

    @Mock
    private MetricsService metrics;

    private InMemoryCodeBank bank;

    @BeforeEach
    void setUp() {
        bank = CatalogFixtures.standardBuilder().metricsService(metrics).build();
    }

    @Test
    @DisplayName("Analyse records duration, best score and a cache miss")
    void analyseRecordsMetrics() {
        bank.getParser(CodeType.LOCODE, null, false).analyse(Query.ofName("Boston"));

        MatcherScope scope = new MatcherScope(CodeType.LOCODE, null, false);
        verify(metrics).recordCacheMiss();
        verify(metrics).recordAnalyseDuration(eq(scope), any(Duration.class));
        verify(metrics).recordBestScore(1.0);
        verify(metrics, never()).incrementNoMatch(any());
    }

    @Test
    @DisplayName("Query without candidates counts a no-match")
    void noMatchCounted() {
        bank.getParser(CodeType.STATE, null, false).analyse(Query.ofName("qqqq"));

        verify(metrics).incrementNoMatch(new MatcherScope(CodeType.STATE, null, false));
        verify(metrics, never()).recordBestScore(anyDouble());
    }

    @Test
    @DisplayName("Cached analyse counts a hit and skips scoring metrics")
    void cacheHitCounted() {
        bank.getParser().analyse(Query.ofName("Paris"));
        bank.getParser().analyse(Query.ofName("Paris"));

        verify(metrics).recordCacheHit();
        verify(metrics, times(1)).recordCacheMiss();
        verify(metrics, times(1)).recordAnalyseDuration(any(), any());
    }

    @Test
    @DisplayName("Nearest search reports whether a locode was found")
    void nearestSearchCounted() {
        bank.getParser(CodeType.LOCODE, null, true).search(40.7, -74.0, null);
        bank.getParser(CodeType.LOCODE, null, true).search(0.0, 0.0, 0.5);

        verify(metrics).incrementNearestSearch(true);
        verify(metrics).incrementNearestSearch(false);
    }
}
