package com.keelson.core.turn;

/**
 * A turn executor failed; recorded in the conversation as {@code turn_error}.
 */
public class TurnExecutionException extends Exception {

    public TurnExecutionException(String message) {
        super(message);
    }

    public TurnExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
