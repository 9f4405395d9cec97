package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.domain.Bullet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineModelAnswerDecomposerTest {

    private final LineModelAnswerDecomposer decomposer = new LineModelAnswerDecomposer();

    @Test
    void oneBulletPerNonBlankLineWithMarkersStripped() {
        List<Bullet> bullets = decomposer.decompose("- heap stores objects\n\n2) stack holds frames\r\n* gc reclaims");

        assertThat(bullets).containsExactly(
                new Bullet("b1", "heap stores objects"),
                new Bullet("b2", "stack holds frames"),
                new Bullet("b3", "gc reclaims"));
    }

    @Test
    void blankAnswerHasNoBullets() {
        assertThat(decomposer.decompose("  \n ")).isEmpty();
        assertThat(decomposer.decompose(null)).isEmpty();
    }
}
