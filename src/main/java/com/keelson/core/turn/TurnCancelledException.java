package com.keelson.core.turn;

/**
 * Thrown inside an executor when its turn has been cancelled.
 */
public class TurnCancelledException extends RuntimeException {

    public TurnCancelledException() {
        super("turn cancelled");
    }
}
