package com.github.jza.automaton.exception;

/**
 * Raised when a list of transitions does not form a connected walk.
 */
public class InvalidSequenceException extends AutomatonException {

    private final int index;

    public InvalidSequenceException(int index, String message) {
        super(message);
        this.index = index;
    }

    /**
     * Index of the first transition whose source is not the target of its predecessor.
     */
    public int getIndex() {
        return index;
    }
}
