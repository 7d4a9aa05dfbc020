package com.keelson.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Keelson.
 */
@Service
public class KeelsonMetrics {

    private final MeterRegistry registry;

    public KeelsonMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param type    action wire name, e.g. {@code send_agent_message}
     * @param outcome {@code ok} or {@code rejected}
     */
    public void recordAction(String type, String outcome) {
        Counter.builder("keelson.actions.total")
                .tag("type", type)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordTurn(String result, long durationMs) {
        Timer.builder("keelson.turn.duration")
                .tag("result", result)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordTurnCanceled() {
        Counter.builder("keelson.turns.canceled")
                .register(registry)
                .increment();
    }

    /**
     * Records a full snapshot sent to a client.
     *
     * @param reason {@code handshake} or {@code lagged}
     */
    public void recordResync(String reason) {
        Counter.builder("keelson.resync.total")
                .description("Full app snapshots pushed to connected clients")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPtyAttach() {
        Counter.builder("keelson.pty.attaches")
                .register(registry)
                .increment();
    }

    public void recordPtyOverflow() {
        Counter.builder("keelson.pty.overflows")
                .description("Terminal listeners detached because they fell behind")
                .register(registry)
                .increment();
    }
}
