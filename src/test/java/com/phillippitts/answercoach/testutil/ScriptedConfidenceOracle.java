package com.phillippitts.answercoach.testutil;

import com.phillippitts.answercoach.domain.ConfidenceVerdict;
import com.phillippitts.answercoach.exception.OracleUnavailableException;
import com.phillippitts.answercoach.service.oracle.ConfidenceOracle;
import com.phillippitts.answercoach.service.oracle.OracleNames;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Confidence oracle returning whatever the test last set. Starts at {@code KNOWS}.
 */
public class ScriptedConfidenceOracle implements ConfidenceOracle {

    private volatile ConfidenceVerdict next = ConfidenceVerdict.KNOWS;
    private volatile boolean fail;
    private final List<String> texts = new CopyOnWriteArrayList<>();

    public void set(ConfidenceVerdict verdict) {
        this.next = verdict;
    }

    public void fail(boolean fail) {
        this.fail = fail;
    }

    @Override
    public ConfidenceVerdict classify(String latestFragmentText) {
        texts.add(latestFragmentText);
        if (fail) {
            throw new OracleUnavailableException("scripted failure", OracleNames.CONFIDENCE);
        }
        return next;
    }

    public List<String> texts() {
        return texts;
    }
}
