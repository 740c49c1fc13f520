package com.locode.resolution.core.model;

import java.util.Map;

/**
 * A state (country), identified by its two-letter code.
 */
public final class State extends Code {

    private State(Builder builder) {
        super(builder);
    }

    @Override
    public CodeType getCodeType() {
        return CodeType.STATE;
    }

    @Override
    protected void collectFields(Map<String, Object> fields) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends Code.Builder<State, Builder> {

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public State build() {
            return new State(this);
        }
    }
}
