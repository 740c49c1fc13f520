package com.locode.resolution.catalog;

import java.util.List;

/**
 * Result of importing catalog records.
 *
 * @param totalRecords  number of records read
 * @param codesImported number of records turned into codes
 * @param errors        records that could not be imported
 */
public record CatalogImportResult(
        long totalRecords,
        long codesImported,
        List<ImportError> errors
) {
    public CatalogImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that could not be imported.
     *
     * @param recordNumber 1-based position of the record in the input, 0 for input-level failures
     * @param identifier   the record identifier when it could be read
     * @param message      the reason
     */
    public record ImportError(long recordNumber, String identifier, String message) {}

    @Override
    public String toString() {
        return "CatalogImportResult{total=" + totalRecords +
                ", imported=" + codesImported +
                ", errors=" + errors.size() + '}';
    }
}
