package com.locode.resolution.core.model;

/**
 * Capability of a code that declares a subdivision of its state.
 * The declared reference is not guaranteed to resolve; see the consistency checker.
 */
public interface SubdivisionReference extends StateReference {

    /**
     * Declared subdivision code, or null when not declared.
     */
    String getSubdivisionCode();

    /**
     * Catalog identifier the declared subdivision resolves to, or null when not declared.
     */
    default String getSubdivisionId() {
        String subdivisionCode = getSubdivisionCode();
        if (subdivisionCode == null || getSupercode() == null) {
            return null;
        }
        return SubDivision.identifierFor(getSupercode(), subdivisionCode);
    }
}
