package com.locode.resolution.geo;

import com.locode.resolution.catalog.CodeBank;
import com.locode.resolution.core.model.Code;
import com.locode.resolution.core.model.CodeType;
import com.locode.resolution.core.model.Coordinates;
import com.locode.resolution.core.model.Locatable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Predicate;

/**
 * Distance and nearest-point queries over coded locations.
 *
 * <p>Distances are planar, in degrees of latitude/longitude. That is adequate at the
 * granularity of the catalog; callers convert to kilometres with {@link #KM_PER_DEGREE}
 * when they need to.</p>
 */
public class GeoLocator {
    private static final Logger log = LoggerFactory.getLogger(GeoLocator.class);

    public static final double KM_PER_DEGREE = 111.0;

    private final CodeBank codeBank;

    public GeoLocator(CodeBank codeBank) {
        this.codeBank = Objects.requireNonNull(codeBank, "codeBank is required");
    }

    /**
     * Distance between two codes, or empty if either lacks coordinates.
     */
    public OptionalDouble distance(Code a, Code b) {
        Optional<Coordinates> first = coordinatesOf(a);
        Optional<Coordinates> second = coordinatesOf(b);
        if (first.isEmpty() || second.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(first.get().distanceTo(second.get()));
    }

    /**
     * Distance between a code and a point, or empty if the code lacks coordinates.
     */
    public OptionalDouble distance(Code code, double latitude, double longitude) {
        return coordinatesOf(code)
                .map(c -> OptionalDouble.of(c.distanceTo(latitude, longitude)))
                .orElse(OptionalDouble.empty());
    }

    /**
     * Closest locode to the point.
     *
     * @param maxRadius when not null, candidates farther than this many degrees are excluded
     * @return the closest candidate, or empty if none qualifies
     */
    public Optional<NearestMatch> nearest(double latitude, double longitude, Double maxRadius) {
        return nearest(latitude, longitude, maxRadius, code -> true);
    }

    /**
     * Closest locode to the point among those accepted by the filter.
     */
    public Optional<NearestMatch> nearest(double latitude, double longitude, Double maxRadius,
                                          Predicate<Code> filter) {
        if (maxRadius != null && (maxRadius < 0 || maxRadius.isNaN())) {
            throw new IllegalArgumentException("maxRadius must be non-negative");
        }
        Double maxSquared = maxRadius != null ? maxRadius * maxRadius : null;

        Code best = null;
        double bestSquared = Double.POSITIVE_INFINITY;
        int scanned = 0;
        for (Code code : codeBank.getValues(CodeType.LOCODE)) {
            Optional<Coordinates> coordinates = coordinatesOf(code);
            if (coordinates.isEmpty() || !filter.test(code)) {
                continue;
            }
            scanned++;
            double squared = coordinates.get().squaredDistanceTo(latitude, longitude);
            if (maxSquared != null && squared > maxSquared) {
                continue;
            }
            if (squared < bestSquared) {
                bestSquared = squared;
                best = code;
            }
        }

        log.debug("nearest.completed lat={} lon={} radius={} scanned={} found={}",
                latitude, longitude, maxRadius, scanned, best != null);
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new NearestMatch(best, Math.sqrt(bestSquared)));
    }

    private static Optional<Coordinates> coordinatesOf(Code code) {
        if (code instanceof Locatable locatable) {
            return locatable.getCoordinates();
        }
        return Optional.empty();
    }
}
