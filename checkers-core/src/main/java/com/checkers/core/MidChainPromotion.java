package com.checkers.core;

/**
 * How a man that reaches the farthest row in the middle of a capture chain is handled.
 */
public enum MidChainPromotion {
    /** The man is crowned and the move ends on the promotion square (English draughts). */
    CROWNING_ENDS_MOVE,
    /** The man is crowned immediately and keeps jumping with king movement. */
    CONTINUE_AS_KING
}
