package com.keelson.core.pty;

import com.keelson.core.config.KeelsonProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntConsumer;

/**
 * Owns the terminal sessions, keyed by {@link PtyKey}.
 */
@Service
public class PtyManager {

    private static final Logger log = LoggerFactory.getLogger(PtyManager.class);

    private final TerminalProcessLauncher launcher;
    private final int historyBytes;
    private final String shell;
    private final int commandRetention;
    private final Map<PtyKey, PtySession> sessions = new ConcurrentHashMap<>();
    private final Deque<PtyKey> finishedCommands = new ArrayDeque<>();

    @Autowired
    public PtyManager(TerminalProcessLauncher launcher, KeelsonProperties properties) {
        this(launcher, properties.getPty().getHistoryBytes(), properties.getPty().resolveShell(),
                properties.getPty().getCommandRetention());
    }

    PtyManager(TerminalProcessLauncher launcher, int historyBytes, String shell, int commandRetention) {
        this.launcher = launcher;
        this.historyBytes = historyBytes;
        this.shell = shell;
        this.commandRetention = Math.max(0, commandRetention);
    }

    /**
     * Returns the session for {@code key}. Interactive shells are started, or restarted when
     * their program exited; command sessions are returned as they are so their output can be
     * replayed.
     */
    public synchronized PtySession attachOrStart(PtyKey key, Path cwd) throws IOException {
        PtySession session = sessions.computeIfAbsent(key,
                k -> new PtySession(k, historyBytes, launcher, List.of(shell, "-i"), cwd, null, false));
        if (!session.isOneShot()) {
            session.restart();
        }
        return session;
    }

    /**
     * Runs a one-off shell command in its own session. Once the command exited and
     * {@code onExit} returned, the session is kept for replay until more than
     * {@code commandRetention} newer commands have finished.
     *
     * @param onExit receives the exit status once the command ends
     * @throws IOException when the command cannot be started
     */
    public synchronized PtySession spawnCommand(PtyKey key, Path cwd, String command, IntConsumer onExit)
            throws IOException {
        PtySession existing = sessions.get(key);
        if (existing != null && !existing.isTerminated()) {
            throw new IllegalStateException("terminal session busy: " + key);
        }
        IntConsumer exitHandler = code -> {
            try {
                if (onExit != null) {
                    onExit.accept(code);
                }
            } finally {
                commandFinished(key);
            }
        };
        PtySession session = new PtySession(key, historyBytes, launcher, List.of(shell, "-c", command), cwd,
                exitHandler, true);
        // registered first so the exit handler can read the output tail
        sessions.put(key, session);
        try {
            session.restart();
        } catch (IOException e) {
            sessions.remove(key);
            throw e;
        }
        log.info("Started command in terminal {}", key);
        return session;
    }

    private synchronized void commandFinished(PtyKey key) {
        finishedCommands.remove(key);
        finishedCommands.addLast(key);
        while (finishedCommands.size() > commandRetention) {
            PtyKey oldest = finishedCommands.removeFirst();
            PtySession evicted = sessions.get(oldest);
            if (evicted != null && evicted.isOneShot() && evicted.isTerminated()) {
                sessions.remove(oldest);
                log.debug("Dropped finished terminal {}", oldest);
            }
        }
    }

    public Optional<PtySession> find(PtyKey key) {
        return Optional.ofNullable(sessions.get(key));
    }

    public int sessionCount() {
        return sessions.size();
    }

    @PreDestroy
    void shutdown() {
        sessions.values().forEach(PtySession::terminate);
    }
}
