package com.phillippitts.answercoach.service.oracle.offline;

import com.phillippitts.answercoach.domain.ConfidenceVerdict;
import com.phillippitts.answercoach.service.oracle.ConfidenceOracle;

import java.util.List;
import java.util.Locale;

/**
 * Offline confidence classifier based on stock phrases.
 *
 * <p>Admissions of not knowing are checked before hedges, so "I'm not sure what that is, I don't
 * know" is {@code DOES_NOT_KNOW}, not {@code UNCERTAIN}.
 */
public final class HedgePhraseConfidenceOracle implements ConfidenceOracle {

    private static final List<String> DOES_NOT_KNOW = List.of(
            "i don't know", "i do not know", "i dont know", "no idea", "no clue", "not sure what",
            "don't remember", "do not remember", "can't remember", "cannot remember", "i forgot",
            "never heard of"
    );

    private static final List<String> UNCERTAIN = List.of(
            "i think", "i guess", "maybe", "perhaps", "probably", "not sure", "not certain",
            "i believe", "might be", "could be", "kind of", "sort of", "if i remember", "i'm not 100"
    );

    @Override
    public ConfidenceVerdict classify(String latestFragmentText) {
        String text = normalize(latestFragmentText);
        if (text.isEmpty()) {
            return ConfidenceVerdict.KNOWS;
        }
        if (containsAny(text, DOES_NOT_KNOW)) {
            return ConfidenceVerdict.DOES_NOT_KNOW;
        }
        if (containsAny(text, UNCERTAIN)) {
            return ConfidenceVerdict.UNCERTAIN;
        }
        return ConfidenceVerdict.KNOWS;
    }

    private static boolean containsAny(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replaceAll("\\s+", " ")
                .strip();
    }
}
