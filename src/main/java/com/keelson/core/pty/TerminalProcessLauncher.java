package com.keelson.core.pty;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts terminal programs. {@link PtyProcessLauncher} runs them on a pseudo-terminal.
 */
public interface TerminalProcessLauncher {

    TerminalProcess launch(List<String> command, Path cwd) throws IOException;
}
