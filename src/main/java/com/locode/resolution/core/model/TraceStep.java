package com.locode.resolution.core.model;

/**
 * One scoring decision recorded while matching a code against a query.
 *
 * @param label  the component or rule that fired (e.g. {@code NAME}, {@code ST})
 * @param detail human-readable description of the decision and its contribution
 */
public record TraceStep(String label, String detail) {

    @Override
    public String toString() {
        return label + ":" + detail;
    }
}
