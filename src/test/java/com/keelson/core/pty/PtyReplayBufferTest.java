package com.keelson.core.pty;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link PtyReplayBuffer}.
 */
class PtyReplayBufferTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    /** Collects chunks; refuses them once {@code limit} is reached. */
    private static final class RecordingListener implements PtyListener {
        final ByteArrayOutputStream received = new ByteArrayOutputStream();
        final int limit;
        int offered;
        boolean overflowed;
        Integer exitCode;

        RecordingListener(int limit) {
            this.limit = limit;
        }

        @Override
        public boolean offer(byte[] chunk) {
            if (offered >= limit) {
                return false;
            }
            offered++;
            received.writeBytes(chunk);
            return true;
        }

        @Override
        public void onOverflow() {
            overflowed = true;
        }

        @Override
        public void onExit(Integer exitCode) {
            this.exitCode = exitCode;
        }
    }

    @Nested
    @DisplayName("ring")
    class Ring {

        @Test
        @DisplayName("keeps only the most recent bytes")
        void keepsTail() {
            PtyReplayBuffer buffer = new PtyReplayBuffer(8);
            buffer.write(bytes("abcdef"));
            buffer.write(bytes("ghij"));

            assertEquals("cdefghij", text(buffer.snapshot()));
            assertEquals(8, buffer.size());
        }

        @Test
        @DisplayName("a chunk larger than the capacity keeps its own tail")
        void oversizedChunk() {
            PtyReplayBuffer buffer = new PtyReplayBuffer(4);
            buffer.write(bytes("ab"));
            buffer.write(bytes("0123456789"));
            assertEquals("6789", text(buffer.snapshot()));
        }

        @Test
        @DisplayName("tail is bounded by what was written")
        void tail() {
            PtyReplayBuffer buffer = new PtyReplayBuffer(16);
            buffer.write(bytes("hello world"));
            assertEquals("world", text(buffer.tail(5)));
            assertEquals("hello world", text(buffer.tail(100)));
            assertEquals(0, buffer.tail(-1).length);
        }
    }

    @Nested
    @DisplayName("attach")
    class Attach {

        @Test
        @DisplayName("replay plus live output contains every byte exactly once")
        void noGapNoDuplicate() throws Exception {
            PtyReplayBuffer buffer = new PtyReplayBuffer(1 << 16);
            int chunks = 2000;
            CountDownLatch halfway = new CountDownLatch(1);
            Thread writer = new Thread(() -> {
                for (int i = 0; i < chunks; i++) {
                    buffer.write(bytes(i + ";"));
                    if (i == chunks / 2) {
                        halfway.countDown();
                    }
                }
            });
            writer.start();
            assertTrue(halfway.await(5, TimeUnit.SECONDS));

            RecordingListener listener = new RecordingListener(Integer.MAX_VALUE);
            PtyReplayBuffer.Attachment attachment = buffer.attach(listener);
            writer.join(5_000);

            String combined = text(attachment.replay()) + listener.received.toString(StandardCharsets.UTF_8);
            List<Integer> seen = new ArrayList<>();
            for (String part : combined.split(";")) {
                seen.add(Integer.parseInt(part));
            }
            assertEquals(chunks, seen.size());
            for (int i = 0; i < chunks; i++) {
                assertEquals(i, seen.get(i));
            }
        }

        @Test
        @DisplayName("a listener that cannot keep up is detached and notified")
        void overflowDetaches() {
            PtyReplayBuffer buffer = new PtyReplayBuffer(64);
            RecordingListener slow = new RecordingListener(1);
            buffer.attach(slow);

            buffer.write(bytes("one"));
            buffer.write(bytes("two"));

            assertTrue(slow.overflowed);
            assertEquals(0, buffer.listenerCount());
            assertEquals("onetwo", text(buffer.snapshot()));
        }

        @Test
        @DisplayName("attaching after exit reports the exit and still replays")
        void attachAfterExit() {
            PtyReplayBuffer buffer = new PtyReplayBuffer(64);
            RecordingListener early = new RecordingListener(10);
            buffer.attach(early);
            buffer.write(bytes("bye"));
            buffer.notifyExit(3);

            assertEquals(3, early.exitCode);
            PtyReplayBuffer.Attachment late = buffer.attach(new RecordingListener(10));
            assertTrue(late.exited());
            assertEquals(3, late.exitCode());
            assertEquals("bye", text(late.replay()));

            buffer.markRunning();
            assertFalse(buffer.attach(new RecordingListener(10)).exited());
        }
    }
}
