package com.gamearena.decision;

/**
 * Thrown by a {@link DecisionProvider} that could not produce an answer:
 * the backing service errored, timed out, or replied with unparsable data.
 */
public class DecisionException extends Exception {
    public DecisionException(String message) {
        super(message);
    }

    public DecisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
