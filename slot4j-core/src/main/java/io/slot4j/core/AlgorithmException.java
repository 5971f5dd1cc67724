package io.slot4j.core;

/**
 * An internal invariant does not hold (e.g. a negative session duration).
 */
public class AlgorithmException extends SchedulingException {

    public AlgorithmException(String message) {
        super(message);
    }
}
