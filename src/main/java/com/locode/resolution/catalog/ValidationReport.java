package com.locode.resolution.catalog;

import java.util.List;

/**
 * Data-quality defects collected by the validation pass of a catalog build.
 */
public record ValidationReport(List<DataQualityDefect> defects) {

    public ValidationReport {
        defects = defects != null ? List.copyOf(defects) : List.of();
    }

    public static ValidationReport empty() {
        return new ValidationReport(List.of());
    }

    public boolean isClean() {
        return defects.isEmpty();
    }

    public List<DataQualityDefect> defectsOfKind(DefectKind kind) {
        return defects.stream()
                .filter(d -> d.kind() == kind)
                .toList();
    }

    @Override
    public String toString() {
        return "ValidationReport{defects=" + defects.size() +
                ", missingNames=" + defectsOfKind(DefectKind.MISSING_NAME).size() +
                ", duplicates=" + defectsOfKind(DefectKind.DUPLICATE_IDENTIFIER).size() + '}';
    }
}
