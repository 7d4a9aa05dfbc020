package com.keelson.core.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Launches terminal programs on a pseudo-terminal through pty4j. Output and error share
 * the terminal, and resize requests reach the program as a window size change.
 */
@Component
public class PtyProcessLauncher implements TerminalProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(PtyProcessLauncher.class);

    static final int INITIAL_COLUMNS = 80;
    static final int INITIAL_ROWS = 24;

    @Override
    public TerminalProcess launch(List<String> command, Path cwd) throws IOException {
        Map<String, String> env = new HashMap<>(System.getenv());
        env.put("TERM", "xterm-256color");
        PtyProcessBuilder builder = new PtyProcessBuilder(command.toArray(new String[0]))
                .setEnvironment(env)
                .setInitialColumns(INITIAL_COLUMNS)
                .setInitialRows(INITIAL_ROWS);
        if (cwd != null && Files.isDirectory(cwd)) {
            builder.setDirectory(cwd.toString());
        }
        return new PtyTerminalProcess(builder.start());
    }

    private static final class PtyTerminalProcess implements TerminalProcess {

        private final PtyProcess process;
        private final OutputStream stdin;

        private PtyTerminalProcess(PtyProcess process) {
            this.process = process;
            this.stdin = process.getOutputStream();
        }

        @Override
        public InputStream output() {
            return process.getInputStream();
        }

        @Override
        public void write(byte[] input) throws IOException {
            synchronized (stdin) {
                stdin.write(input);
                stdin.flush();
            }
        }

        @Override
        public void resize(int cols, int rows) {
            if (cols <= 0 || rows <= 0 || !process.isAlive()) {
                return;
            }
            try {
                process.setWinSize(new WinSize(cols, rows));
            } catch (IllegalStateException e) {
                log.debug("Resize to {}x{} failed: {}", cols, rows, e.getMessage());
            }
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public int waitFor() throws InterruptedException {
            return process.waitFor();
        }

        @Override
        public void destroy() {
            process.destroy();
        }
    }
}
