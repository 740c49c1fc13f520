package com.locode.resolution.catalog;

/**
 * Kinds of data-quality defect found while building a catalog.
 */
public enum DefectKind {
    /**
     * The code has no name at all.
     */
    MISSING_NAME,

    /**
     * A second code was added with an identifier already used for its type; the first one is kept.
     */
    DUPLICATE_IDENTIFIER
}
