package com.checkers.core;

/**
 * Thrown when a move is malformed or not legal on the board it is applied to.
 */
public class InvalidMoveException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidMoveException(String message) {
        super(message);
    }
}
