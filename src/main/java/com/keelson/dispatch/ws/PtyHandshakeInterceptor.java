package com.keelson.dispatch.ws;

import com.keelson.core.model.TaskKey;
import com.keelson.core.model.Workdir;
import com.keelson.core.pty.PtyKey;
import com.keelson.core.task.TaskRegistry;
import com.keelson.core.workdir.WorkdirRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves {@code /api/pty/{workdir_id}/{task_id}?reconnect=token} before the upgrade and
 * refuses unknown workdirs or tasks with 404.
 */
@Component
public class PtyHandshakeInterceptor implements HandshakeInterceptor {

    static final String PTY_KEY = "keelson.ptyKey";
    static final String WORKDIR_PATH = "keelson.workdirPath";

    private final WorkdirRegistry workdirs;
    private final TaskRegistry tasks;

    public PtyHandshakeInterceptor(WorkdirRegistry workdirs, TaskRegistry tasks) {
        this.workdirs = workdirs;
        this.tasks = tasks;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        UriComponents uri = UriComponentsBuilder.fromUri(request.getURI()).build();
        List<String> segments = uri.getPathSegments();
        // api, pty, workdir, task
        if (segments.size() != 4) {
            response.setStatusCode(HttpStatus.NOT_FOUND);
            return false;
        }
        long workdirId;
        long taskId;
        try {
            workdirId = Long.parseLong(segments.get(2));
            taskId = Long.parseLong(segments.get(3));
        } catch (NumberFormatException e) {
            response.setStatusCode(HttpStatus.BAD_REQUEST);
            return false;
        }
        Optional<Workdir> workdir = workdirs.find(workdirId);
        if (workdir.isEmpty() || tasks.find(new TaskKey(workdirId, taskId)).isEmpty()) {
            response.setStatusCode(HttpStatus.NOT_FOUND);
            return false;
        }
        String reconnect = uri.getQueryParams().getFirst("reconnect");
        attributes.put(PTY_KEY, new PtyKey(workdirId, taskId, reconnect));
        attributes.put(WORKDIR_PATH, workdir.get().path());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }
}
