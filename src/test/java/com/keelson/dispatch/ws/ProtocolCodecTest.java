package com.keelson.dispatch.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keelson.core.engine.ClientAction;
import com.keelson.core.engine.ProtocolException;
import com.keelson.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolCodecTest {

    private final ProtocolCodec codec = new ProtocolCodec(new ObjectMapper());

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        @DisplayName("hello with and without a last seen revision")
        void hello() {
            var hello = assertInstanceOf(WsClientMessage.Hello.class,
                    codec.decode("{\"type\":\"hello\",\"protocol_version\":1,\"last_seen_rev\":12}"));
            assertEquals(1, hello.protocolVersion());
            assertEquals(12L, hello.lastSeenRev());

            var fresh = assertInstanceOf(WsClientMessage.Hello.class,
                    codec.decode("{\"type\":\"hello\",\"protocol_version\":1}"));
            assertNull(fresh.lastSeenRev());
        }

        @Test
        @DisplayName("actions decode into their typed records, accepting legacy status names")
        void action() {
            var message = assertInstanceOf(WsClientMessage.Action.class, codec.decode("""
                    {"type":"action","request_id":"r1",
                     "action":{"type":"task_status_set","workdir_id":1,"task_id":2,"task_status":"in_review"}}
                    """));
            assertEquals("r1", message.requestId());
            var action = assertInstanceOf(ClientAction.TaskStatusSet.class, message.action());
            assertEquals(TaskStatus.VALIDATING, action.taskStatus());
        }

        @Test
        @DisplayName("a send without task id decodes with a null task id")
        void sendWithoutTask() {
            var message = (WsClientMessage.Action) codec.decode("""
                    {"type":"action","request_id":"r2",
                     "action":{"type":"send_agent_message","workdir_id":3,"text":"hi"}}
                    """);
            var send = assertInstanceOf(ClientAction.SendAgentMessage.class, message.action());
            assertNull(send.taskId());
            assertEquals("hi", send.text());
        }

        @Test
        @DisplayName("unknown action tags are typed protocol errors carrying the request id")
        void unknownAction() {
            ProtocolException e = assertThrows(ProtocolException.class, () -> codec.decode("""
                    {"type":"action","request_id":"r3","action":{"type":"format_disk"}}
                    """));
            assertEquals("r3", e.requestId());
            assertTrue(e.getMessage().contains("unknown action type: format_disk"), e.getMessage());
        }

        @Test
        @DisplayName("malformed input is rejected")
        void malformed() {
            assertThrows(ProtocolException.class, () -> codec.decode("{not json"));
            assertThrows(ProtocolException.class, () -> codec.decode("[1,2]"));
            ProtocolException missing = assertThrows(ProtocolException.class,
                    () -> codec.decode("{\"protocol_version\":1}"));
            assertTrue(missing.getMessage().contains("missing message type"), missing.getMessage());
        }

        @Test
        @DisplayName("ping has no body")
        void ping() {
            assertInstanceOf(WsClientMessage.Ping.class, codec.decode("{\"type\":\"ping\"}"));
        }
    }

    @Test
    @DisplayName("server messages are tagged and snake_cased")
    void encode() {
        assertEquals("{\"type\":\"ack\",\"request_id\":\"r1\",\"rev\":4}",
                codec.encode(new WsServerMessage.Ack("r1", 4)));
        assertEquals("{\"type\":\"error\",\"message\":\"bad\"}",
                codec.encode(new WsServerMessage.Error(null, "bad")));
        assertEquals("{\"type\":\"pong\"}", codec.encode(new WsServerMessage.Pong()));
    }
}
