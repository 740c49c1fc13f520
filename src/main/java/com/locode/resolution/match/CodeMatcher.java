package com.locode.resolution.match;

import com.locode.resolution.cache.AnalysisCache;
import com.locode.resolution.catalog.CodeBank;
import com.locode.resolution.core.model.Code;
import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.core.model.Coordinates;
import com.locode.resolution.core.model.Locatable;
import com.locode.resolution.core.model.MatchResult;
import com.locode.resolution.core.model.State;
import com.locode.resolution.core.model.StateReference;
import com.locode.resolution.core.model.SubDivision;
import com.locode.resolution.core.model.SubdivisionReference;
import com.locode.resolution.core.model.TraceStep;
import com.locode.resolution.geo.GeoLocator;
import com.locode.resolution.geo.NearestMatch;
import com.locode.resolution.logging.LogContext;
import com.locode.resolution.metrics.MetricsService;
import com.locode.resolution.similarity.NameScore;
import com.locode.resolution.similarity.NameScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Ranks catalog codes against a structured {@link Query}.
 *
 * <p>Every candidate in the scope is scored: the name component through the
 * {@link NameScorer} ladder, and each structural hint against the field the candidate
 * declares. A hint naming a referenced code (a state or subdivision) is resolved through
 * the catalog and scored by name. Hints agreeing with the candidate add to the score,
 * hints contradicting a declared field subtract the same amount, so a correct hint never
 * lowers the score of the true match and a wrong one never raises it.</p>
 *
 * <p>Each result carries a trace of the decisions taken, one step per component.</p>
 *
 * <p>Instances are obtained from {@link CodeBank#getParser(CodeType, String, boolean)}
 * and hold no mutable state; they may be shared between threads.</p>
 */
public class CodeMatcher {
    private static final Logger log = LoggerFactory.getLogger(CodeMatcher.class);

    private static final Comparator<MatchResult> BY_SCORE_DESC =
            Comparator.comparingDouble(MatchResult::score).reversed();

    private final CodeBank codeBank;
    private final MatcherScope scope;
    private final MatchingOptions options;
    private final NameScorer nameScorer;
    private final GeoLocator geoLocator;
    private final AnalysisCache cache;
    private final MetricsService metrics;

    public CodeMatcher(CodeBank codeBank, MatcherScope scope, MatchingOptions options,
                       AnalysisCache cache, MetricsService metrics) {
        this.codeBank = Objects.requireNonNull(codeBank, "codeBank is required");
        this.scope = Objects.requireNonNull(scope, "scope is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.nameScorer = new NameScorer(options.getNameScoringWeights());
        this.geoLocator = new GeoLocator(codeBank);
    }

    /**
     * Returns the single best match, unwrapped.
     *
     * <p>This is the one-result form of {@link #analyse(Query, int)}: callers asking for
     * one match get the result itself rather than a list. When no candidate scores above
     * zero the result is {@link MatchResult#noMatch()}.</p>
     *
     * @throws InvalidQueryException if the query is empty or malformed
     */
    public MatchResult analyse(Query query) {
        List<MatchResult> results = analyse(query, 1);
        return results.isEmpty() ? MatchResult.noMatch() : results.get(0);
    }

    /**
     * Returns up to {@code matches} candidates with a positive score, by non-increasing score.
     * Ties keep catalog order.
     *
     * @throws InvalidQueryException if the query is empty or malformed
     */
    public List<MatchResult> analyse(Query query, int matches) {
        validate(query);
        if (matches < 1) {
            throw new IllegalArgumentException("matches must be at least 1, got " + matches);
        }

        Optional<List<MatchResult>> cached = cache.get(scope, query, matches);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();

        long start = System.nanoTime();
        List<MatchResult> results;
        try (LogContext ctx = LogContext.forQuery(LogContext.generateCorrelationId(), scope.label())) {
            List<Code> candidates = candidates();
            List<MatchResult> scored = new ArrayList<>(candidates.size());
            for (Code candidate : candidates) {
                MatchResult result = score(candidate, query);
                if (result.score() > 0) {
                    scored.add(result);
                }
            }
            // List.sort is stable, so equal scores keep catalog order
            scored.sort(BY_SCORE_DESC);
            results = List.copyOf(scored.subList(0, Math.min(matches, scored.size())));

            log.debug("analyse.completed query={} candidates={} scored={} returned={}",
                    query, candidates.size(), scored.size(), results.size());
        }

        metrics.recordAnalyseDuration(scope, Duration.ofNanos(System.nanoTime() - start));
        if (results.isEmpty()) {
            metrics.incrementNoMatch(scope);
        } else {
            metrics.recordBestScore(results.get(0).score());
        }
        cache.put(scope, query, matches, results);
        return results;
    }

    /**
     * Scores one code against the query without searching the catalog.
     *
     * @throws InvalidQueryException if the query is empty or malformed
     */
    public MatchResult match(Code code, Query query) {
        Objects.requireNonNull(code, "code is required");
        validate(query);
        return score(code, query);
    }

    /**
     * Finds the locode in scope closest to the point.
     *
     * @param maxRadius maximum distance in degrees, or null for no limit
     * @throws IllegalStateException if this matcher was created without distances
     */
    public Optional<NearestMatch> search(double latitude, double longitude, Double maxRadius) {
        if (!scope.distances()) {
            throw new IllegalStateException("Distance search is not available: matcher for scope "
                    + scope.label() + " was created without distances");
        }
        Optional<NearestMatch> nearest = geoLocator.nearest(latitude, longitude, maxRadius, this::inScope);
        metrics.incrementNearestSearch(nearest.isPresent());
        return nearest;
    }

    private void validate(Query query) {
        Objects.requireNonNull(query, "query is required");
        if (query.isEmpty()) {
            throw new InvalidQueryException("Query must have at least one non-empty component");
        }
        for (Map.Entry<String, String> component : query.components().entrySet()) {
            if (QueryComponent.fromTag(component.getKey()).orElse(null) == QueryComponent.COORDINATES) {
                Coordinates.parse(component.getValue());
            }
        }
    }

    private List<Code> candidates() {
        List<Code> values = codeBank.getValues(scope.codeType());
        if (scope.state() == null) {
            return values;
        }
        return values.stream().filter(this::inScope).toList();
    }

    private boolean inScope(Code code) {
        if (scope.codeType() != null && code.getCodeType() != scope.codeType()) {
            return false;
        }
        if (scope.state() == null) {
            return true;
        }
        return scope.state().equalsIgnoreCase(stateOf(code));
    }

    private MatchResult score(Code code, Query query) {
        List<TraceStep> trace = new ArrayList<>();
        double total = 0.0;

        for (Map.Entry<String, String> component : query.components().entrySet()) {
            String tag = component.getKey();
            String value = component.getValue();
            if (value.isBlank()) {
                continue;
            }
            if (Query.NAME.equals(tag)) {
                NameScore nameScore = nameScorer.score(code, value);
                double contribution = options.getNameWeight() * nameScore.score();
                trace.add(new TraceStep("NAME", nameScore + " -> " + signed(contribution)));
                total += contribution;
                continue;
            }

            Optional<QueryComponent> known = QueryComponent.fromTag(tag);
            if (known.isEmpty()) {
                trace.add(new TraceStep(tag, "unknown component, ignored"));
                continue;
            }
            total += switch (known.get()) {
                case STATE -> scoreStateHint(code, tag, value, trace);
                case SUBDIVISION -> scoreSubdivisionHint(code, tag, value, trace);
                case COORDINATES -> scoreProximity(code, tag, value, trace);
            };
        }

        return new MatchResult(code, total, trace);
    }

    private double scoreStateHint(Code code, String tag, String hint, List<TraceStep> trace) {
        if (code instanceof State) {
            return compareReference(tag, hint, code.getIdentifier(), code.getIdentifier(),
                    () -> Optional.of(code), trace);
        }
        if (code instanceof StateReference reference) {
            String declared = reference.getSupercode();
            return compareReference(tag, hint, declared, declared,
                    () -> codeBank.get(declared, CodeType.STATE), trace);
        }
        trace.add(new TraceStep(tag, "not applicable to " + code.getCodeType() + " -> " + signed(0)));
        return 0.0;
    }

    private double scoreSubdivisionHint(Code code, String tag, String hint, List<TraceStep> trace) {
        if (code instanceof SubDivision subdivision) {
            return compareReference(tag, hint, subdivision.getSubcode(), subdivision.getIdentifier(),
                    () -> Optional.of(code), trace);
        }
        if (code instanceof SubdivisionReference reference) {
            String qualified = reference.getSubdivisionId();
            return compareReference(tag, hint, reference.getSubdivisionCode(), qualified,
                    () -> codeBank.get(qualified, CodeType.SUBDIVISION), trace);
        }
        trace.add(new TraceStep(tag, "not applicable to " + code.getCodeType() + " -> " + signed(0)));
        return 0.0;
    }

    /**
     * Compares a hint with a declared reference: first as a code, either bare ({@code MO}) or
     * state-qualified ({@code US:MO}), then as the name of the referenced code.
     */
    private double compareReference(String tag, String hint, String declared, String qualified,
                                    Supplier<Optional<Code>> referenced, List<TraceStep> trace) {
        double weight = options.getHintWeight();
        if (declared == null) {
            trace.add(new TraceStep(tag, "not declared -> " + signed(0)));
            return 0.0;
        }
        String code = hint.trim();
        if (code.equalsIgnoreCase(declared) || code.equalsIgnoreCase(qualified)) {
            trace.add(new TraceStep(tag, "code '" + code.toUpperCase(Locale.ROOT) + "' agrees -> "
                    + signed(weight)));
            return weight;
        }

        Optional<Code> reference = referenced.get();
        if (reference.isPresent()) {
            NameScore nameScore = nameScorer.score(reference.get(), hint);
            if (nameScore.tier().isExplicit()) {
                double contribution = weight * Math.min(1.0, nameScore.score());
                trace.add(new TraceStep(tag, "name of " + reference.get().getIdentifier() + " "
                        + nameScore + " -> " + signed(contribution)));
                return contribution;
            }
        }
        trace.add(new TraceStep(tag, "'" + hint + "' disagrees with '" + declared + "' -> " + signed(-weight)));
        return -weight;
    }

    private double scoreProximity(Code code, String tag, String value, List<TraceStep> trace) {
        if (!scope.distances()) {
            trace.add(new TraceStep(tag, "distances disabled -> " + signed(0)));
            return 0.0;
        }
        Coordinates target = Coordinates.parse(value);
        Optional<Coordinates> coordinates = code instanceof Locatable locatable
                ? locatable.getCoordinates()
                : Optional.empty();
        if (coordinates.isEmpty()) {
            trace.add(new TraceStep(tag, "no coordinates -> " + signed(0)));
            return 0.0;
        }
        double distance = coordinates.get().distanceTo(target);
        double contribution = options.getHintWeight()
                * Math.max(0.0, 1.0 - distance / options.getProximityRadius());
        trace.add(new TraceStep(tag, String.format(Locale.ROOT, "%.4f deg -> %s", distance, signed(contribution))));
        return contribution;
    }

    private static String stateOf(Code code) {
        if (code instanceof State) {
            return code.getIdentifier();
        }
        if (code instanceof StateReference reference) {
            return reference.getSupercode();
        }
        return null;
    }

    private static String signed(double value) {
        return String.format(Locale.ROOT, "%+.3f", value);
    }
}
