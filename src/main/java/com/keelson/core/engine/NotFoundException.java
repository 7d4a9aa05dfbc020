package com.keelson.core.engine;

/**
 * The action or request names a workdir, task, prompt or attachment that does not exist.
 */
public class NotFoundException extends ActionRejectedException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException workdir(long workdirId) {
        return new NotFoundException("workdir not found: " + workdirId);
    }

    public static NotFoundException task(long workdirId, long taskId) {
        return new NotFoundException("task not found: " + workdirId + "/" + taskId);
    }
}
