package com.phillippitts.answercoach.service.oracle;

import java.util.List;

/**
 * Composes the wording of a follow-up question. The scheduler decides which bullet; this decides how to ask.
 */
@FunctionalInterface
public interface PhrasingOracle {

    /**
     * Deterministic wording used whenever a phrasing oracle fails.
     */
    String FALLBACK_TEMPLATE = "You haven't clearly covered this point yet: '%s'. Could you elaborate?";

    /**
     * @param targetBulletText     canonical text of the bullet being asked about
     * @param uncoveredBulletTexts every bullet still missing, for context
     * @return question text
     */
    String compose(String targetBulletText, List<String> uncoveredBulletTexts);

    static String fallback(String targetBulletText) {
        return String.format(FALLBACK_TEMPLATE, targetBulletText);
    }
}
