package com.keelson.core.pty;

/**
 * Identity of a terminal session. Reattaching with the same key resumes the same session.
 *
 * @param workdirId workdir the shell runs in
 * @param taskId    task the terminal belongs to
 * @param reconnect client-chosen token, {@code default} when absent
 */
public record PtyKey(long workdirId, long taskId, String reconnect) {

    public static final String DEFAULT_RECONNECT = "default";

    public PtyKey {
        if (reconnect == null || reconnect.isBlank()) {
            reconnect = DEFAULT_RECONNECT;
        }
    }
}
