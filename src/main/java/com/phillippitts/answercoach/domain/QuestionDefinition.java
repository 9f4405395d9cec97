package com.phillippitts.answercoach.domain;

import java.util.List;
import java.util.Objects;

/**
 * The question a session tracks: its identity, labels, and the model answer already decomposed
 * into bullets.
 *
 * @param questionId   stable question identifier
 * @param questionText question as asked
 * @param tags         topic tags (e.g. "Operating Systems")
 * @param subtags      finer labels (e.g. "Concurrency")
 * @param bullets      ordered bullet set; declaration order drives follow-up priority ties
 */
public record QuestionDefinition(
        String questionId,
        String questionText,
        List<String> tags,
        List<String> subtags,
        List<Bullet> bullets
) {

    public QuestionDefinition {
        Objects.requireNonNull(questionId, "questionId");
        questionText = questionText == null ? "" : questionText;
        tags = tags == null ? List.of() : List.copyOf(tags);
        subtags = subtags == null ? List.of() : List.copyOf(subtags);
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
    }
}
