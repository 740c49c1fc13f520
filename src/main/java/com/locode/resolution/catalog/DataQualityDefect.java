package com.locode.resolution.catalog;

import com.locode.resolution.core.model.CodeType;

import java.util.Objects;

/**
 * A non-fatal problem with one catalog record.
 */
public record DataQualityDefect(
        String identifier,
        CodeType codeType,
        DefectKind kind,
        String message
) {
    public DataQualityDefect {
        Objects.requireNonNull(identifier, "identifier is required");
        Objects.requireNonNull(kind, "kind is required");
    }
}
