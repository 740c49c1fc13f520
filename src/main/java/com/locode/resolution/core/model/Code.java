package com.locode.resolution.core.model;

import com.locode.resolution.similarity.NameScorer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of every catalog record.
 *
 * <p>A code is a flat, immutable record: references to other codes are held as
 * identifiers and are never resolved here. Whole-catalog properties such as
 * reference consistency are checked by the consistency checker.</p>
 *
 * <p>A code without any name can be built; the catalog validation pass reports it
 * as a data-quality defect.</p>
 */
public abstract class Code {
    private final String identifier;
    private final List<String> alternativeNames;

    protected Code(Builder<?, ?> builder) {
        this.identifier = Objects.requireNonNull(builder.identifier, "identifier is required");
        this.alternativeNames = Collections.unmodifiableList(new ArrayList<>(builder.alternativeNames));
    }

    public String getIdentifier() {
        return identifier;
    }

    public abstract CodeType getCodeType();

    /**
     * Ordered alternative names; the first one is the canonical name.
     */
    public List<String> getAlternativeNames() {
        return alternativeNames;
    }

    /**
     * Canonical name, or null for a nameless code.
     */
    public String getName() {
        return alternativeNames.isEmpty() ? null : alternativeNames.get(0);
    }

    public boolean hasName() {
        return !alternativeNames.isEmpty();
    }

    /**
     * Scores a candidate name against this code's alternative names with the default weights.
     */
    public double nameScore(String testName) {
        return NameScorer.defaultScorer().score(this, testName).score();
    }

    /**
     * Type-specific structural fields that are set, in declaration order.
     */
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        collectFields(fields);
        fields.values().removeIf(Objects::isNull);
        return fields;
    }

    protected abstract void collectFields(Map<String, Object> fields);

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Code code = (Code) o;
        return getCodeType() == code.getCodeType() && identifier.equals(code.identifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getCodeType(), identifier);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<bln|")
                .append(getCodeType().getLabel()).append('#').append(identifier);
        if (hasName()) {
            sb.append("|\"").append(getName()).append('"');
        }
        return sb.append('>').toString();
    }

    /**
     * Shared builder state for all code types.
     */
    public abstract static class Builder<T extends Code, B extends Builder<T, B>> {
        private String identifier;
        private final List<String> alternativeNames = new ArrayList<>();

        protected abstract B self();

        public abstract T build();

        public B identifier(String identifier) {
            this.identifier = identifier;
            return self();
        }

        protected void identifierIfAbsent(String derived) {
            if (identifier == null) {
                identifier = derived;
            }
        }

        /**
         * Sets the canonical name. Blank names are ignored.
         */
        public B name(String name) {
            if (name != null && !name.isBlank()) {
                alternativeNames.remove(name);
                alternativeNames.add(0, name);
            }
            return self();
        }

        /**
         * Appends alternative names after the canonical one. Blank and duplicate names are ignored.
         */
        public B alternativeNames(Collection<String> names) {
            if (names != null) {
                for (String name : names) {
                    if (name != null && !name.isBlank() && !alternativeNames.contains(name)) {
                        alternativeNames.add(name);
                    }
                }
            }
            return self();
        }

        public B alternativeNames(String... names) {
            return alternativeNames(List.of(names));
        }
    }
}
