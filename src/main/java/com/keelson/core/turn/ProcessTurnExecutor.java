package com.keelson.core.turn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keelson.core.conversation.AgentEvent;
import com.keelson.core.model.AgentItem;
import com.keelson.core.model.AgentItemKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Runs an external agent command per turn.
 * <p>
 * The prompt is written to the command's stdin. Each stdout line that is a JSON object is
 * interpreted as:
 * <ul>
 *   <li>{@code {"id":..,"kind":..,"payload":{..}}}: an agent item</li>
 *   <li>{@code {"message":".."}}: an agent message</li>
 *   <li>{@code {"usage":{..}}}: token usage of the turn</li>
 * </ul>
 * Any other output is collected and emitted as the final agent message. A non-zero exit
 * status fails the turn.
 */
public class ProcessTurnExecutor implements TurnExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessTurnExecutor.class);
    private static final int ERROR_TAIL_LINES = 20;

    private final List<String> command;
    private final ObjectMapper objectMapper;

    public ProcessTurnExecutor(List<String> command, ObjectMapper objectMapper) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("keelson.agent.command must be set for the process executor");
        }
        this.command = List.copyOf(command);
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return "process";
    }

    @Override
    public TurnOutcome execute(TurnRequest request, TurnSink sink, CancellationToken token)
            throws TurnExecutionException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        if (request.workdir() != null && request.workdir().toFile().isDirectory()) {
            pb.directory(request.workdir().toFile());
        }
        pb.environment().put("KEELSON_WORKDIR_ID", String.valueOf(request.task().workdirId()));
        pb.environment().put("KEELSON_TASK_ID", String.valueOf(request.task().taskId()));
        pb.environment().put("KEELSON_TURN_ID", request.turnId());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TurnExecutionException("agent spawn failed: " + e.getMessage(), e);
        }
        token.onCancel(process::destroy);

        JsonNode usage = null;
        StringBuilder text = new StringBuilder();
        Deque<String> tail = new ArrayDeque<>();
        int messageSeq = 0;
        try {
            writePromptAsync(process, request);
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    token.throwIfCancelled();
                    if (tail.size() == ERROR_TAIL_LINES) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                    JsonNode node = parseObject(line);
                    if (node == null) {
                        text.append(line).append('\n');
                    } else if (node.hasNonNull("kind") && node.hasNonNull("id")) {
                        AgentItemKind kind = parseKind(node.get("kind").asText());
                        if (kind == null) {
                            text.append(line).append('\n');
                        } else {
                            sink.emit(new AgentEvent.Item(new AgentItem(
                                    node.get("id").asText(), kind, node.get("payload"))));
                        }
                    } else if (node.hasNonNull("message")) {
                        messageSeq++;
                        sink.emit(new AgentEvent.Message(request.turnId() + "_m" + messageSeq,
                                node.get("message").asText()));
                    } else if (node.has("usage")) {
                        usage = node.get("usage");
                    } else {
                        text.append(line).append('\n');
                    }
                }
            }
            int exit = process.waitFor();
            token.throwIfCancelled();
            if (exit != 0) {
                throw new TurnExecutionException("agent exited with status " + exit + ": " + String.join("\n", tail));
            }
        } catch (IOException e) {
            token.throwIfCancelled();
            throw new TurnExecutionException("agent io failed: " + e.getMessage(), e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }

        String finalText = text.toString().strip();
        if (!finalText.isEmpty()) {
            sink.emit(new AgentEvent.Message(request.turnId() + "_final", finalText));
        }
        return new TurnOutcome(usage);
    }

    /** Feeds the prompt on its own thread so stdout is drained while stdin is being written. */
    private void writePromptAsync(Process process, TurnRequest request) {
        byte[] prompt = request.prompt().getBytes(StandardCharsets.UTF_8);
        Thread writer = new Thread(() -> {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(prompt);
            } catch (IOException e) {
                log.debug("Prompt write for turn {} stopped: {}", request.turnId(), e.getMessage());
            }
        }, "agent-stdin-" + request.turnId());
        writer.setDaemon(true);
        writer.start();
    }

    private JsonNode parseObject(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            return node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Agent output line is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private AgentItemKind parseKind(String kind) {
        try {
            return AgentItemKind.fromWire(kind);
        } catch (IllegalArgumentException e) {
            log.debug("Unknown agent item kind: {}", kind);
            return null;
        }
    }
}
