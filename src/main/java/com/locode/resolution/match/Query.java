package com.locode.resolution.match;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A structured query: free-text values keyed by component.
 *
 * <p>The reserved {@link #NAME} component holds the entity name; other components are
 * structural hints keyed by an upper-cased tag such as {@code CO} or {@code SD}.
 * Setting a component twice keeps the last value.</p>
 */
public final class Query {

    public static final String NAME = "name";

    private final Map<String, String> components;

    private Query(Map<String, String> components) {
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public static Query ofName(String name) {
        return builder().name(name).build();
    }

    /**
     * Components in insertion order.
     */
    public Map<String, String> components() {
        return components;
    }

    public String get(String component) {
        return components.get(normalizeTag(component));
    }

    public String name() {
        return components.get(NAME);
    }

    /**
     * Returns true when no component carries a non-blank value.
     */
    public boolean isEmpty() {
        return components.values().stream().allMatch(String::isBlank);
    }

    static String normalizeTag(String tag) {
        String trimmed = tag.trim();
        return NAME.equalsIgnoreCase(trimmed) ? NAME : trimmed.toUpperCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return components.equals(((Query) o).components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(components);
    }

    @Override
    public String toString() {
        return components.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> components = new LinkedHashMap<>();

        public Builder name(String name) {
            return component(NAME, name);
        }

        /**
         * Sets a component. Null values are ignored; a repeated tag replaces the earlier value.
         */
        public Builder component(String tag, String value) {
            Objects.requireNonNull(tag, "tag is required");
            if (tag.isBlank()) {
                throw new IllegalArgumentException("tag must not be blank");
            }
            if (value != null) {
                components.put(normalizeTag(tag), value.trim());
            }
            return this;
        }

        public Query build() {
            return new Query(components);
        }
    }
}
