package com.github.jza.automaton.exception;

/**
 * A chained construction kept running into dead ends and ran out of attempts.
 */
public class GenerationFailedException extends AutomatonException {

    private final int attempts;

    public GenerationFailedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
