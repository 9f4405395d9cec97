package com.phillippitts.answercoach.service.oracle;

/**
 * Names under which oracle calls are logged, metered and reported in health.
 */
public final class OracleNames {

    public static final String COVERAGE = "coverage";
    public static final String CONFIDENCE = "confidence";
    public static final String CLAIM = "claim";
    public static final String SIMILARITY = "similarity";
    public static final String PHRASING = "phrasing";

    private OracleNames() {
    }
}
