package com.checkers.core;

/**
 * Signals that a board was queried in a state the request does not fit, such as generating moves
 * for the side that is not to move.
 */
public class InvalidStateException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public InvalidStateException(String message) {
        super(message);
    }
}
