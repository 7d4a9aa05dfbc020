package com.keelson.core.pty;

/**
 * Live consumer of terminal output attached to a {@link PtyReplayBuffer}.
 */
public interface PtyListener {

    /**
     * Hands over a chunk of output. Must not block; called with the buffer lock held.
     *
     * @return false when the listener cannot keep up; it is then detached
     */
    boolean offer(byte[] chunk);

    /**
     * Called after the listener was detached because {@link #offer} returned false.
     */
    void onOverflow();

    /**
     * Called when the session's process exited.
     */
    void onExit(Integer exitCode);
}
