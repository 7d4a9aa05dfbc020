package com.keelson.core.pty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * A terminal session: one program at a time plus the replay buffer that outlives it.
 * When the program exits the session is marked terminated; {@link #restart()} starts the
 * same program again on the same buffer.
 */
public class PtySession {

    private static final Logger log = LoggerFactory.getLogger(PtySession.class);
    private static final int READ_CHUNK = 8192;

    private final PtyKey key;
    private final PtyReplayBuffer buffer;
    private final TerminalProcessLauncher launcher;
    private final List<String> command;
    private final Path cwd;
    private final IntConsumer exitHandler;
    private final boolean oneShot;

    private volatile TerminalProcess process;
    private volatile boolean terminated = true;
    private volatile Integer exitCode;

    PtySession(PtyKey key, int historyBytes, TerminalProcessLauncher launcher,
               List<String> command, Path cwd, IntConsumer exitHandler, boolean oneShot) {
        this.key = key;
        this.buffer = new PtyReplayBuffer(historyBytes);
        this.launcher = launcher;
        this.command = List.copyOf(command);
        this.cwd = cwd;
        this.exitHandler = exitHandler;
        this.oneShot = oneShot;
    }

    public PtyKey key() {
        return key;
    }

    public PtyReplayBuffer buffer() {
        return buffer;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public Integer exitCode() {
        return exitCode;
    }

    /**
     * Whether this session runs a single command. Such sessions are never restarted.
     */
    public boolean isOneShot() {
        return oneShot;
    }

    /**
     * Starts the program if it is not running. The buffer keeps the previous run's output.
     */
    public synchronized void restart() throws IOException {
        if (!terminated) {
            return;
        }
        TerminalProcess started = launcher.launch(command, cwd);
        buffer.markRunning();
        process = started;
        exitCode = null;
        terminated = false;
        Thread reader = new Thread(() -> pump(started), "pty-" + key.workdirId() + "-" + key.taskId() + "-" + key.reconnect());
        reader.setDaemon(true);
        reader.start();
        log.debug("Started terminal {} ({})", key, command);
    }

    public void writeInput(byte[] input) throws IOException {
        TerminalProcess current = process;
        if (current == null || terminated) {
            return;
        }
        current.write(input);
    }

    public void resize(int cols, int rows) {
        TerminalProcess current = process;
        if (current != null && !terminated) {
            current.resize(cols, rows);
        }
    }

    public void terminate() {
        TerminalProcess current = process;
        if (current != null) {
            current.destroy();
        }
    }

    private void pump(TerminalProcess running) {
        byte[] chunk = new byte[READ_CHUNK];
        try (InputStream in = running.output()) {
            int n;
            while ((n = in.read(chunk)) != -1) {
                if (n > 0) {
                    buffer.write(Arrays.copyOf(chunk, n));
                }
            }
        } catch (IOException e) {
            log.debug("Terminal {} output closed: {}", key, e.getMessage());
        }
        int code;
        try {
            code = running.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            code = -1;
        }
        synchronized (this) {
            if (process == running) {
                exitCode = code;
                terminated = true;
            }
        }
        log.debug("Terminal {} exited with {}", key, code);
        buffer.notifyExit(code);
        if (exitHandler != null) {
            exitHandler.accept(code);
        }
    }
}
