package com.keelson.dispatch.ws;

import com.keelson.core.events.BoundedChannel;
import com.keelson.core.pty.PtyListener;
import com.keelson.core.pty.PtySession;

import java.util.function.Consumer;

/**
 * A terminal socket's attachment to a {@link PtySession}: live chunks go through a bounded
 * channel drained by the socket's pump thread.
 */
class PtyConnection implements PtyListener {

    /** Marker queued when the program exits. */
    static final byte[] EXITED = new byte[0];

    private final PtySession session;
    private final BoundedChannel<byte[]> channel;
    private final Consumer<PtyConnection> overflowHandler;

    PtyConnection(PtySession session, int capacity, Consumer<PtyConnection> overflowHandler) {
        this.session = session;
        this.channel = new BoundedChannel<>(capacity);
        this.overflowHandler = overflowHandler;
    }

    PtySession session() {
        return session;
    }

    BoundedChannel<byte[]> channel() {
        return channel;
    }

    @Override
    public boolean offer(byte[] chunk) {
        return channel.offer(chunk);
    }

    @Override
    public void onOverflow() {
        channel.close();
        overflowHandler.accept(this);
    }

    @Override
    public void onExit(Integer exitCode) {
        channel.offer(EXITED);
    }

    void detach() {
        session.buffer().detach(this);
        channel.close();
    }
}
