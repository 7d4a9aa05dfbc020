package com.keelson.core.logging;

import com.keelson.core.model.TaskKey;
import org.slf4j.MDC;

/**
 * Utility for managing Keelson-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(TaskKey task) {
        MDC.put("workdirId", String.valueOf(task.workdirId()));
        MDC.put("taskId", String.valueOf(task.taskId()));
    }

    public static void setRequest(String connectionId, String requestId) {
        if (connectionId != null) {
            MDC.put("connectionId", connectionId);
        }
        if (requestId != null) {
            MDC.put("requestId", requestId);
        }
    }

    public static void setConnection(String connectionId) {
        MDC.put("connectionId", connectionId);
    }

    public static void clearTask() {
        MDC.remove("workdirId");
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("workdirId");
        MDC.remove("taskId");
        MDC.remove("requestId");
        MDC.remove("connectionId");
    }
}
