package com.phillippitts.answercoach.service.engine;

import com.phillippitts.answercoach.domain.TranscriptFragment;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptBufferTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private static TranscriptFragment fragment(long seq, String text) {
        return new TranscriptFragment(seq, text, T0);
    }

    @Test
    void emptyBufferNeverEvaluates() {
        TranscriptBuffer buffer = new TranscriptBuffer(Duration.ofSeconds(20), 3, T0);

        assertThat(buffer.shouldEvaluate(T0.plusSeconds(3600))).isFalse();
    }

    @Test
    void countTriggerFiresAtThreshold() {
        TranscriptBuffer buffer = new TranscriptBuffer(Duration.ofSeconds(20), 3, T0);
        buffer.ingest(fragment(0, "a"));
        buffer.ingest(fragment(1, "b"));
        assertThat(buffer.shouldEvaluate(T0)).isFalse();

        buffer.ingest(fragment(2, "c"));
        assertThat(buffer.shouldEvaluate(T0)).isTrue();
    }

    @Test
    void timeTriggerNeedsStrictlyMoreThanInterval() {
        TranscriptBuffer buffer = new TranscriptBuffer(Duration.ofSeconds(20), 3, T0);
        buffer.ingest(fragment(0, "a"));

        assertThat(buffer.shouldEvaluate(T0.plusSeconds(20))).isFalse();
        assertThat(buffer.shouldEvaluate(T0.plusMillis(20_001))).isTrue();
    }

    @Test
    void drainJoinsInArrivalOrderAndResets() {
        TranscriptBuffer buffer = new TranscriptBuffer(Duration.ofSeconds(20), 3, T0);
        buffer.ingest(fragment(1, "  second "));
        buffer.ingest(fragment(0, "first"));
        buffer.ingest(fragment(2, "   "));
        buffer.ingest(fragment(3, "third"));

        Instant now = T0.plusSeconds(5);
        assertThat(buffer.drain(now)).isEqualTo("second first third");
        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.getLastEvaluationAt()).isEqualTo(now);
    }

    @Test
    void drainingEmptyBufferYieldsEmptyText() {
        TranscriptBuffer buffer = new TranscriptBuffer(Duration.ofSeconds(20), 3, T0);

        assertThat(buffer.drain(T0)).isEmpty();
    }

    @Test
    void intervalRestartsFromLastDrain() {
        TranscriptBuffer buffer = new TranscriptBuffer(Duration.ofSeconds(20), 5, T0);
        buffer.ingest(fragment(0, "a"));
        buffer.drain(T0.plusSeconds(30));
        buffer.ingest(fragment(1, "b"));

        assertThat(buffer.shouldEvaluate(T0.plusSeconds(45))).isFalse();
        assertThat(buffer.shouldEvaluate(T0.plusSeconds(51))).isTrue();
    }

    @Test
    void rejectsInvalidTriggers() {
        assertThatThrownBy(() -> new TranscriptBuffer(Duration.ZERO, 3, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TranscriptBuffer(Duration.ofSeconds(1), 0, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
