package io.slot4j.core;

/**
 * Caller input that cannot be searched: no sessions, no participants, a missing or inverted date range.
 */
public class ValidationException extends SchedulingException {

    public ValidationException(String message) {
        super(message);
    }
}
