package com.phillippitts.answercoach.service.oracle.gemini;

import java.util.List;

/**
 * Prompt texts sent to Gemini. Each asks for JSON only.
 */
final class GeminiPrompts {

    private GeminiPrompts() {}

    static String coverage(String bulletText, String fullAnswerText) {
        return "You are evaluating whether the following bullet point has been fully addressed\n"
                + "in the candidate's complete answer.\n\n"
                + "Bullet point:\n\"" + bulletText + "\"\n\n"
                + "Candidate's full answer so far (lines starting with [FOLLOW-UP] are questions the\n"
                + "interviewer asked, not the candidate's words):\n\"\"\"" + fullAnswerText + "\"\"\"\n\n"
                + "Mark as:\n"
                + "- covered: the idea is clearly or implicitly covered, even with different wording.\n"
                + "- partial: the idea is touched upon but lacks clarity or completeness.\n"
                + "- incomplete: the idea is missing or wrong.\n\n"
                + "Be forgiving to rephrasings like \"O of n log n\" vs \"log-linear time\", and to spoken\n"
                + "variations like \"O of n square\" for O(n^2) or \"split into halves\" for \"divide recursively\".\n\n"
                + "Examples:\n"
                + "Bullet: \"Quicksort average-case is O(n log n)\"\n"
                + "Answer: \"Quicksort takes roughly n log n time on average\" -> covered\n"
                + "Bullet: \"Quicksort worst-case is O(n^2)\"\n"
                + "Answer: \"It can degrade if the pivot is bad\" -> partial\n\n"
                + "Return JSON only: {\"status\": \"<covered|partial|incomplete>\"}";
    }

    static String confidence(String text) {
        return "You are analyzing a transcript segment from a technical interview.\n"
                + "Determine if the speaker seems confident, uncertain, or admits not knowing.\n\n"
                + "Return JSON with a single key \"state\" whose value is one of:\n"
                + "[\"knows\", \"uncertain\", \"does_not_know\"].\n\n"
                + "Transcript:\n\"\"\"" + text + "\"\"\"\n\n"
                + "Return JSON only.";
    }

    static String claims(String text) {
        return "Extract the discrete factual claims the speaker makes in this interview answer segment.\n"
                + "Ignore filler and hesitation. Keep the speaker's meaning; do not add facts.\n\n"
                + "Segment:\n\"\"\"" + text + "\"\"\"\n\n"
                + "Return JSON only: [{\"claim\": \"...\", \"entities\": [\"...\"], \"predicate\": \"...\"}]";
    }

    static String phrasing(String targetBulletText, List<String> uncoveredBulletTexts) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a friendly technical interviewer. The candidate has not clearly covered this point:\n\"")
                .append(targetBulletText).append("\"\n\n");
        if (!uncoveredBulletTexts.isEmpty()) {
            sb.append("Other points still missing (do not ask about them now):\n");
            for (String other : uncoveredBulletTexts) {
                if (!other.equals(targetBulletText)) {
                    sb.append("- ").append(other).append('\n');
                }
            }
            sb.append('\n');
        }
        sb.append("Write one short follow-up question that nudges the candidate toward the point without\n")
                .append("giving the answer away.\n\n")
                .append("Return JSON only: {\"question\": \"...\"}");
        return sb.toString();
    }
}
