package com.github.jza.automaton.exception;

/**
 * Weighted sampling was asked to choose from a set with no positive weight.
 */
public class NoViableChoiceException extends AutomatonException {

    public NoViableChoiceException(String message) {
        super(message);
    }
}
