package com.keelson.dispatch.api;

import com.keelson.core.conversation.ConversationSnapshot;
import com.keelson.core.engine.NotFoundException;
import com.keelson.core.engine.SnapshotService;
import com.keelson.core.model.TaskKey;
import com.keelson.core.task.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Paginated conversation reads and the per-task SSE stream. Served under both
 * {@code /api/workspaces} and {@code /api/workdirs}.
 */
@RestController
@RequestMapping({"/api/workspaces/{workdirId}/conversations", "/api/workdirs/{workdirId}/conversations"})
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

    private final SnapshotService snapshots;
    private final TaskRegistry tasks;
    private final ConversationStreamService streamService;

    public ConversationController(SnapshotService snapshots, TaskRegistry tasks,
                                  ConversationStreamService streamService) {
        this.snapshots = snapshots;
        this.tasks = tasks;
        this.streamService = streamService;
    }

    /**
     * A page of entries ending before index {@code before}; without {@code limit} the whole
     * log up to {@code before} is returned.
     */
    @GetMapping("/{taskId}")
    public ResponseEntity<ConversationSnapshot> conversation(@PathVariable long workdirId,
                                                             @PathVariable long taskId,
                                                             @RequestParam(required = false) Integer before,
                                                             @RequestParam(required = false) Integer limit) {
        try {
            return ResponseEntity.ok(snapshots.conversation(new TaskKey(workdirId, taskId), before, limit));
        } catch (NotFoundException e) {
            log.debug("Conversation read for unknown task {}/{}", workdirId, taskId);
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping(value = "/{taskId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> stream(@PathVariable long workdirId, @PathVariable long taskId) {
        TaskKey key = new TaskKey(workdirId, taskId);
        if (tasks.find(key).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(streamService.createEmitter(key));
    }
}
