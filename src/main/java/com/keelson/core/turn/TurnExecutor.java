package com.keelson.core.turn;

/**
 * Runs one agent turn. Implementations are opaque agents (a subprocess, an SDK client, ...).
 * <p>
 * {@link #execute} runs on a turn-runner thread and may block. It should poll
 * {@code token} between steps and stop promptly once it is cancelled; a cancelled turn's
 * output is discarded.
 */
public interface TurnExecutor {

    /** Short identifier for logs and metrics. */
    String id();

    TurnOutcome execute(TurnRequest request, TurnSink sink, CancellationToken token)
            throws TurnExecutionException, InterruptedException;
}
