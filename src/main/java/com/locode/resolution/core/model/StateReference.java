package com.locode.resolution.core.model;

/**
 * Capability of a code that declares the state (country) it belongs to.
 */
public interface StateReference {

    /**
     * Identifier of the parent state, or null when not declared.
     */
    String getSupercode();
}
