package com.keelson.core.engine;

/**
 * A well-formed action is not valid for the current state. Thrown before anything is
 * mutated, so a rejected action never advances the revision.
 */
public class ActionRejectedException extends RuntimeException {

    public ActionRejectedException(String message) {
        super(message);
    }
}
