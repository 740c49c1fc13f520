package com.locode.resolution.catalog;

import com.locode.resolution.cache.AnalysisCache;
import com.locode.resolution.cache.CacheConfig;
import com.locode.resolution.core.model.Code;
import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.match.CodeMatcher;
import com.locode.resolution.match.MatcherScope;
import com.locode.resolution.match.MatchingOptions;
import com.locode.resolution.metrics.MetricsService;
import com.locode.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Memory-resident catalog built once and read-only afterwards.
 *
 * <p>Nothing is written after {@link Builder#build()}, so an instance can be shared
 * by any number of reader threads without locking.</p>
 */
public class InMemoryCodeBank implements CodeBank {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCodeBank.class);

    private final Map<CodeType, Map<String, Code>> codesByType;
    private final Map<CodeType, List<Code>> valuesByType;
    private final List<Code> allCodes;
    private final ValidationReport validationReport;
    private final MatchingOptions matchingOptions;
    private final MetricsService metricsService;
    private final AnalysisCache analysisCache;

    private InMemoryCodeBank(Builder builder, ValidationReport validationReport) {
        Map<CodeType, Map<String, Code>> byType = new EnumMap<>(CodeType.class);
        Map<CodeType, List<Code>> values = new EnumMap<>(CodeType.class);
        List<Code> all = new ArrayList<>();
        for (CodeType type : CodeType.values()) {
            Map<String, Code> codes = builder.codes.getOrDefault(type, Map.of());
            byType.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(codes)));
            values.put(type, List.copyOf(codes.values()));
            all.addAll(codes.values());
        }
        this.codesByType = Collections.unmodifiableMap(byType);
        this.valuesByType = Collections.unmodifiableMap(values);
        this.allCodes = List.copyOf(all);
        this.validationReport = validationReport;
        this.matchingOptions = builder.matchingOptions;
        this.metricsService = builder.metricsService;
        this.analysisCache = AnalysisCache.create(builder.cacheConfig);
    }

    @Override
    public Optional<Code> get(String identifier, CodeType type) {
        Objects.requireNonNull(type, "type is required");
        if (identifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codesByType.get(type).get(identifier));
    }

    @Override
    public List<Code> getValues(CodeType type) {
        if (type == null) {
            return allCodes;
        }
        return valuesByType.get(type);
    }

    @Override
    public CodeMatcher getParser(CodeType type, String state, boolean distances) {
        return new CodeMatcher(this, new MatcherScope(type, state, distances),
                matchingOptions, analysisCache, metricsService);
    }

    @Override
    public ValidationReport getValidationReport() {
        return validationReport;
    }

    public int size() {
        return allCodes.size();
    }

    public int size(CodeType type) {
        return codesByType.get(type).size();
    }

    public AnalysisCache getAnalysisCache() {
        return analysisCache;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<CodeType, Map<String, Code>> codes = new EnumMap<>(CodeType.class);
        private final CatalogValidator validator = new CatalogValidator();
        private MatchingOptions matchingOptions = MatchingOptions.defaults();
        private MetricsService metricsService = new NoOpMetricsService();
        private CacheConfig cacheConfig = CacheConfig.defaults();

        /**
         * Adds a code. A duplicate identifier within a type is reported and ignored.
         */
        public Builder add(Code code) {
            Objects.requireNonNull(code, "code is required");
            Map<String, Code> byId = codes.computeIfAbsent(code.getCodeType(), t -> new LinkedHashMap<>());
            if (byId.containsKey(code.getIdentifier())) {
                validator.duplicate(code);
                return this;
            }
            validator.inspect(code);
            byId.put(code.getIdentifier(), code);
            return this;
        }

        public Builder addAll(Collection<? extends Code> codes) {
            codes.forEach(this::add);
            return this;
        }

        public Builder matchingOptions(MatchingOptions matchingOptions) {
            this.matchingOptions = Objects.requireNonNull(matchingOptions, "matchingOptions is required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public InMemoryCodeBank build() {
            ValidationReport report = validator.report();
            InMemoryCodeBank bank = new InMemoryCodeBank(this, report);
            log.info("catalog.built locodes={} subdivisions={} states={} defects={}",
                    bank.size(CodeType.LOCODE), bank.size(CodeType.SUBDIVISION), bank.size(CodeType.STATE),
                    report.defects().size());
            return bank;
        }
    }
}
