package com.phillippitts.answercoach.exception;

/**
 * Thrown when a session or the application is configured with values the engine cannot run with
 * (duplicate bullet ids, blank bullet text, thresholds outside their range, non-positive intervals).
 *
 * <p>Always fatal at construction time: a session is never created from an invalid configuration.
 */
public class ConfigurationException extends AnswerCoachException {

    private final String setting;

    public ConfigurationException(String setting, String message) {
        super(message + " (setting: " + setting + ")");
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
