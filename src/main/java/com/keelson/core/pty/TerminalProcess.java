package com.keelson.core.pty;

import java.io.IOException;
import java.io.InputStream;

/**
 * A running terminal program as seen by a {@link PtySession}.
 */
public interface TerminalProcess {

    InputStream output();

    void write(byte[] input) throws IOException;

    void resize(int cols, int rows);

    boolean isAlive();

    int waitFor() throws InterruptedException;

    void destroy();
}
