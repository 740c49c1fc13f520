package com.locode.resolution.match;

import com.locode.resolution.similarity.NameScoringWeights;

/**
 * Weights used by the matcher to combine per-component scores.
 *
 * <p>The total score of a candidate is
 * {@code nameWeight * nameScore + sum(hint contributions)}. A hint that agrees with the
 * candidate adds up to {@code hintWeight}, a hint that contradicts a declared field
 * subtracts {@code hintWeight}, and a coordinate hint adds
 * {@code hintWeight * max(0, 1 - distance / proximityRadius)}.</p>
 */
public class MatchingOptions {

    private static final double DEFAULT_NAME_WEIGHT = 1.0;
    private static final double DEFAULT_HINT_WEIGHT = 0.25;
    private static final double DEFAULT_PROXIMITY_RADIUS = 1.0;

    private final double nameWeight;
    private final double hintWeight;
    private final double proximityRadius;
    private final NameScoringWeights nameScoringWeights;

    private MatchingOptions(Builder builder) {
        this.nameWeight = builder.nameWeight;
        this.hintWeight = builder.hintWeight;
        this.proximityRadius = builder.proximityRadius;
        this.nameScoringWeights = builder.nameScoringWeights;
    }

    public double getNameWeight() {
        return nameWeight;
    }

    public double getHintWeight() {
        return hintWeight;
    }

    /**
     * Distance in degrees at which a coordinate hint stops contributing.
     */
    public double getProximityRadius() {
        return proximityRadius;
    }

    public NameScoringWeights getNameScoringWeights() {
        return nameScoringWeights;
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double nameWeight = DEFAULT_NAME_WEIGHT;
        private double hintWeight = DEFAULT_HINT_WEIGHT;
        private double proximityRadius = DEFAULT_PROXIMITY_RADIUS;
        private NameScoringWeights nameScoringWeights = NameScoringWeights.defaults();

        public Builder nameWeight(double nameWeight) {
            validatePositive(nameWeight, "nameWeight");
            this.nameWeight = nameWeight;
            return this;
        }

        public Builder hintWeight(double hintWeight) {
            if (hintWeight < 0) {
                throw new IllegalArgumentException("hintWeight must be non-negative");
            }
            this.hintWeight = hintWeight;
            return this;
        }

        public Builder proximityRadius(double proximityRadius) {
            validatePositive(proximityRadius, "proximityRadius");
            this.proximityRadius = proximityRadius;
            return this;
        }

        public Builder nameScoringWeights(NameScoringWeights nameScoringWeights) {
            if (nameScoringWeights == null) {
                throw new IllegalArgumentException("nameScoringWeights is required");
            }
            this.nameScoringWeights = nameScoringWeights;
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }

        private void validatePositive(double value, String name) {
            if (value <= 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "nameWeight=" + nameWeight +
                ", hintWeight=" + hintWeight +
                ", proximityRadius=" + proximityRadius +
                ", nameScoringWeights=" + nameScoringWeights +
                '}';
    }
}
