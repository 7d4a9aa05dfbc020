package com.keelson.core.turn;

import com.keelson.core.config.KeelsonProperties;
import com.keelson.core.logging.MdcContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs turns on a bounded thread pool and reports their events and completion through
 * {@link TurnCallbacks}.
 */
@Service
public class TurnRunner {

    private static final Logger log = LoggerFactory.getLogger(TurnRunner.class);

    private final TurnExecutor executor;
    private final ExecutorService pool;

    @Autowired
    public TurnRunner(TurnExecutor executor, KeelsonProperties properties) {
        this(executor, properties.getAgent().getMaxConcurrentTurns());
    }

    TurnRunner(TurnExecutor executor, int maxConcurrentTurns) {
        this.executor = executor;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, maxConcurrentTurns), r -> {
            Thread t = new Thread(r, "turn-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Turn runner started (executor={}, maxConcurrentTurns={})", executor.id(), maxConcurrentTurns);
    }

    /**
     * Schedules a turn. Cancelling {@code token} interrupts the turn's thread; the callbacks
     * are still invoked and the receiver decides whether they are stale.
     */
    public void launch(TurnRequest request, CancellationToken token, TurnCallbacks callbacks) {
        Future<?> future = pool.submit(() -> run(request, token, callbacks));
        token.onCancel(() -> future.cancel(true));
    }

    private void run(TurnRequest request, CancellationToken token, TurnCallbacks callbacks) {
        MdcContext.setTask(request.task());
        long started = System.currentTimeMillis();
        TurnCompletion completion;
        try {
            TurnOutcome outcome = executor.execute(request,
                    event -> {
                        if (!token.isCancelled()) {
                            callbacks.onAgentEvent(request.task(), request.turnId(), event);
                        }
                    },
                    token);
            completion = TurnCompletion.succeeded(outcome == null ? null : outcome.usage(),
                    System.currentTimeMillis() - started);
        } catch (TurnCancelledException e) {
            log.debug("Turn {} cancelled", request.turnId());
            completion = TurnCompletion.failed("cancelled", System.currentTimeMillis() - started);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Turn {} interrupted", request.turnId());
            completion = TurnCompletion.failed("interrupted", System.currentTimeMillis() - started);
        } catch (TurnExecutionException e) {
            log.warn("Turn {} failed: {}", request.turnId(), e.getMessage());
            completion = TurnCompletion.failed(e.getMessage(), System.currentTimeMillis() - started);
        } catch (RuntimeException e) {
            log.warn("Turn {} failed unexpectedly: {}", request.turnId(), e.getMessage(), e);
            completion = TurnCompletion.failed(
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                    System.currentTimeMillis() - started);
        }
        try {
            callbacks.onTurnFinished(request.task(), request.turnId(), completion);
        } finally {
            MdcContext.clear();
        }
    }

    @PreDestroy
    void shutdown() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Turn runner did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
