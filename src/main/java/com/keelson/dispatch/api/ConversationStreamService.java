package com.keelson.dispatch.api;

import com.keelson.core.events.EventBus;
import com.keelson.core.events.KeelsonEvent;
import com.keelson.core.events.ServerEvent;
import com.keelson.core.model.TaskKey;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges per-task {@link EventBus} subscriptions to {@link SseEmitter}s.
 * <p>
 * Only {@code conversation_changed} events are forwarded; each frame is named after the
 * event and carries {@code {rev, event}}, with the revision as the SSE id. Heartbeat
 * comments keep idle connections open through proxies.
 */
@Service
public class ConversationStreamService {

    private static final Logger log = LoggerFactory.getLogger(ConversationStreamService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ConversationStreamService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    ConversationStreamService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                log.debug("Heartbeat failed for task {}: {}", registration.task, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for task {} (emitter not active)", registration.task);
            }
        }
    }

    /**
     * Creates an emitter streaming the conversation changes of one task.
     */
    public SseEmitter createEmitter(TaskKey task) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(task, event -> {
            if (event.event() instanceof ServerEvent.ConversationChanged) {
                sendEvent(emitter, event);
            }
        });

        var registration = new EmitterRegistration(task, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for task {}: {}", task, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for task {}: {}", task, e.getMessage());
        }

        log.debug("SSE emitter created for task {} (timeout={}ms)", task, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, KeelsonEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("rev", event.rev());
            data.put("event", event.event());
            emitter.send(SseEmitter.event()
                    .id(String.valueOf(event.rev()))
                    .name("conversation_changed")
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event for task {}: {}", event.task(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            TaskKey task,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
