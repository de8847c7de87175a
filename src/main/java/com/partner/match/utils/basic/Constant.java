package com.partner.match.utils.basic;

public final class Constant {
    private Constant() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String OUTCOME_TAG = "outcome";
    public static final String METHOD_TAG = "method";
    public static final String RESULT_COUNT_TAG = "results";
    public static final String UNKNOWN = "unknown";
}
