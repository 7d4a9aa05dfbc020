package com.keelson.core.turn;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keelson.core.conversation.AgentEvent;
import com.keelson.core.model.AgentItem;
import com.keelson.core.model.AgentItemKind;

/**
 * Built-in executor that echoes the prompt back in a few paced steps. Used for local runs
 * and demos when no agent command is configured.
 */
public class EchoTurnExecutor implements TurnExecutor {

    private final long stepDelayMs;

    public EchoTurnExecutor(long stepDelayMs) {
        this.stepDelayMs = Math.max(0, stepDelayMs);
    }

    @Override
    public String id() {
        return "echo";
    }

    @Override
    public TurnOutcome execute(TurnRequest request, TurnSink sink, CancellationToken token)
            throws InterruptedException {
        ObjectNode reasoning = JsonNodeFactory.instance.objectNode();
        reasoning.put("text", "Reading the request");
        sink.emit(new AgentEvent.Item(new AgentItem(request.turnId() + "_r", AgentItemKind.REASONING, reasoning)));
        pause(token);

        ObjectNode command = JsonNodeFactory.instance.objectNode();
        command.put("command", "echo");
        command.put("status", "completed");
        command.put("exit_code", 0);
        sink.emit(new AgentEvent.Item(new AgentItem(request.turnId() + "_c", AgentItemKind.COMMAND_EXECUTION, command)));
        pause(token);

        sink.emit(new AgentEvent.Message(request.turnId() + "_m", "Echo: " + request.prompt()));

        ObjectNode usage = JsonNodeFactory.instance.objectNode();
        usage.put("input_tokens", request.prompt().length());
        usage.put("output_tokens", request.prompt().length() + 6);
        return new TurnOutcome(usage);
    }

    private void pause(CancellationToken token) throws InterruptedException {
        token.throwIfCancelled();
        if (stepDelayMs > 0) {
            Thread.sleep(stepDelayMs);
        }
        token.throwIfCancelled();
    }
}
