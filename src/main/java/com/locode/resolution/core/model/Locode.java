package com.locode.resolution.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * A location code such as {@code US NYC}: a state code followed by a location subcode.
 */
public final class Locode extends Code implements SubdivisionReference, Locatable {
    private final String supercode;
    private final String subcode;
    private final String subdivisionCode;
    private final String functionCode;
    private final Coordinates coordinates;

    private Locode(Builder builder) {
        super(builder);
        this.supercode = builder.supercode;
        this.subcode = builder.subcode;
        this.subdivisionCode = builder.subdivisionCode;
        this.functionCode = builder.functionCode;
        this.coordinates = builder.coordinates;
    }

    @Override
    public CodeType getCodeType() {
        return CodeType.LOCODE;
    }

    @Override
    public String getSupercode() {
        return supercode;
    }

    public String getSubcode() {
        return subcode;
    }

    @Override
    public String getSubdivisionCode() {
        return subdivisionCode;
    }

    public String getFunctionCode() {
        return functionCode;
    }

    @Override
    public Optional<Coordinates> getCoordinates() {
        return Optional.ofNullable(coordinates);
    }

    @Override
    protected void collectFields(Map<String, Object> fields) {
        fields.put("supercode", supercode);
        fields.put("subcode", subcode);
        fields.put("subdivision_code", subdivisionCode);
        fields.put("function_code", functionCode);
        fields.put("coordinates", coordinates);
    }

    public static String identifierFor(String stateId, String subcode) {
        return stateId + " " + subcode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends Code.Builder<Locode, Builder> {
        private String supercode;
        private String subcode;
        private String subdivisionCode;
        private String functionCode;
        private Coordinates coordinates;

        @Override
        protected Builder self() {
            return this;
        }

        public Builder supercode(String supercode) {
            this.supercode = supercode;
            return this;
        }

        public Builder subcode(String subcode) {
            this.subcode = subcode;
            return this;
        }

        public Builder subdivisionCode(String subdivisionCode) {
            this.subdivisionCode = subdivisionCode;
            return this;
        }

        public Builder functionCode(String functionCode) {
            this.functionCode = functionCode;
            return this;
        }

        public Builder coordinates(Coordinates coordinates) {
            this.coordinates = coordinates;
            return this;
        }

        public Builder coordinates(double latitude, double longitude) {
            return coordinates(new Coordinates(latitude, longitude));
        }

        /**
         * Builds the locode, deriving the identifier from supercode and subcode when it was not set.
         */
        @Override
        public Locode build() {
            if (supercode != null && subcode != null) {
                identifierIfAbsent(identifierFor(supercode, subcode));
            }
            return new Locode(this);
        }
    }
}
