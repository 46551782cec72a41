package com.prediction.market.lmsr_engine.exception;

/**
 * Undo refused: the bet was already undone, partially sold, settled, or the
 * market moved after it.
 */
public class UndoNotAllowedException extends MarketException {

    public UndoNotAllowedException(String message) {
        super(ErrorKind.UNDO_NOT_ALLOWED, message);
    }
}
