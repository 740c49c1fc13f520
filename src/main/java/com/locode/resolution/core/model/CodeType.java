package com.locode.resolution.core.model;

import java.util.Locale;

/**
 * Enumeration of code types held by the catalog.
 * Declaration order is the lookup order used when no type is given.
 */
public enum CodeType {
    LOCODE("locode"),
    SUBDIVISION("subdivision"),
    STATE("state");

    private final String label;

    CodeType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a type from its label or constant name, ignoring case.
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static CodeType fromLabel(String label) {
        if (label != null) {
            String trimmed = label.trim();
            for (CodeType type : values()) {
                if (type.label.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown code type: " + label);
    }

    @Override
    public String toString() {
        return label.toUpperCase(Locale.ROOT);
    }
}
