package com.phillippitts.answercoach.service.oracle.offline;

import com.phillippitts.answercoach.service.oracle.PhrasingOracle;

import java.util.List;

/**
 * Offline phrasing: the fixed follow-up template around the bullet's own wording.
 */
public final class TemplatePhrasingOracle implements PhrasingOracle {

    @Override
    public String compose(String targetBulletText, List<String> uncoveredBulletTexts) {
        return PhrasingOracle.fallback(targetBulletText);
    }
}
