package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.domain.Bullet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * One bullet per non-blank line, with list markers ("-", "*", "•", "1.", "2)") removed.
 * Ids are {@code b1..bn}.
 */
@Component
public class LineModelAnswerDecomposer implements ModelAnswerDecomposer {

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*•]+|\\d+[.)])\\s*");

    @Override
    public List<Bullet> decompose(String modelAnswer) {
        if (modelAnswer == null || modelAnswer.isBlank()) {
            return List.of();
        }
        List<Bullet> bullets = new ArrayList<>();
        for (String line : modelAnswer.split("\\R")) {
            String text = LIST_MARKER.matcher(line).replaceFirst("").strip();
            if (!text.isEmpty()) {
                bullets.add(new Bullet("b" + (bullets.size() + 1), text));
            }
        }
        return List.copyOf(bullets);
    }
}
