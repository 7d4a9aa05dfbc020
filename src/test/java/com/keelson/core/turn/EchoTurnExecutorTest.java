package com.keelson.core.turn;

import com.keelson.core.conversation.AgentEvent;
import com.keelson.core.model.AgentItemKind;
import com.keelson.core.model.TaskKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EchoTurnExecutorTest {

    private static final TurnRequest REQUEST = new TurnRequest(new TaskKey(1, 1), "t1", "hi", null, null);

    @Test
    @DisplayName("emits reasoning, a command and the echoed message")
    void echoes() throws Exception {
        List<AgentEvent> events = new ArrayList<>();
        TurnOutcome outcome = new EchoTurnExecutor(0).execute(REQUEST, events::add, new CancellationToken());

        assertEquals(3, events.size());
        assertEquals(AgentItemKind.REASONING, ((AgentEvent.Item) events.get(0)).item().kind());
        assertEquals(AgentItemKind.COMMAND_EXECUTION, ((AgentEvent.Item) events.get(1)).item().kind());
        assertEquals("Echo: hi", ((AgentEvent.Message) events.get(2)).text());
        assertEquals(2, outcome.usage().get("input_tokens").asInt());
    }

    @Test
    @DisplayName("stops at the first step once cancelled")
    void cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        List<AgentEvent> events = new ArrayList<>();

        assertThrows(TurnCancelledException.class,
                () -> new EchoTurnExecutor(0).execute(REQUEST, events::add, token));
        assertEquals(1, events.size());
    }
}
