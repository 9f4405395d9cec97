package com.phillippitts.answercoach.domain;

import java.util.Objects;

/**
 * One atomic, independently verifiable point of a model answer.
 *
 * @param id   identifier, unique within a session (e.g. "b1")
 * @param text canonical wording of the point; also the input handed to the phrasing oracle
 */
public record Bullet(String id, String text) {

    public Bullet {
        Objects.requireNonNull(id, "Bullet id must not be null");
        Objects.requireNonNull(text, "Bullet text must not be null");
    }
}
