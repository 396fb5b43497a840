package com.github.jza.automaton.exception;

/**
 * Base class of all failures raised by the automaton and its sequences.
 */
public class AutomatonException extends RuntimeException {

    public AutomatonException(String message) {
        super(message);
    }

    public AutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
