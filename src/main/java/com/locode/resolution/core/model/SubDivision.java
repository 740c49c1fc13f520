package com.locode.resolution.core.model;

import java.util.Map;

/**
 * A subdivision (region, province, county) of a state, identified as {@code STATE:CODE}.
 */
public final class SubDivision extends Code implements StateReference {
    private final String supercode;
    private final String subcode;
    private final String subdivisionType;

    private SubDivision(Builder builder) {
        super(builder);
        this.supercode = builder.supercode;
        this.subcode = builder.subcode;
        this.subdivisionType = builder.subdivisionType;
    }

    @Override
    public CodeType getCodeType() {
        return CodeType.SUBDIVISION;
    }

    @Override
    public String getSupercode() {
        return supercode;
    }

    public String getSubcode() {
        return subcode;
    }

    public String getSubdivisionType() {
        return subdivisionType;
    }

    @Override
    protected void collectFields(Map<String, Object> fields) {
        fields.put("supercode", supercode);
        fields.put("subcode", subcode);
        fields.put("subdivision_type", subdivisionType);
    }

    public static String identifierFor(String stateId, String subcode) {
        return stateId + ":" + subcode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends Code.Builder<SubDivision, Builder> {
        private String supercode;
        private String subcode;
        private String subdivisionType;

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

        public Builder subdivisionType(String subdivisionType) {
            this.subdivisionType = subdivisionType;
            return this;
        }

        @Override
        public SubDivision build() {
            if (supercode != null && subcode != null) {
                identifierIfAbsent(identifierFor(supercode, subcode));
            }
            return new SubDivision(this);
        }
    }
}
