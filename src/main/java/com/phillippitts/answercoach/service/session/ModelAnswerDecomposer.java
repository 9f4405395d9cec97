package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.domain.Bullet;

import java.util.List;

/**
 * Splits a model answer into the bullets a session tracks.
 */
@FunctionalInterface
public interface ModelAnswerDecomposer {

    /**
     * @param modelAnswer free-form model answer
     * @return bullets with ids unique within the result, declaration order
     */
    List<Bullet> decompose(String modelAnswer);
}
