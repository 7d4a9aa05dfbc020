package com.keelson.core.logging;

import com.keelson.core.model.TaskKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTask puts workdirId and taskId in MDC")
    void setTask() {
        MdcContext.setTask(new TaskKey(3, 7));
        assertEquals("3", MDC.get("workdirId"));
        assertEquals("7", MDC.get("taskId"));
    }

    @Test
    @DisplayName("setRequest skips null ids")
    void setRequest() {
        MdcContext.setRequest("c1", null);
        assertEquals("c1", MDC.get("connectionId"));
        assertNull(MDC.get("requestId"));
    }

    @Test
    @DisplayName("clearTask keeps the connection")
    void clearTask() {
        MdcContext.setConnection("c1");
        MdcContext.setTask(new TaskKey(1, 1));
        MdcContext.clearTask();
        assertNull(MDC.get("taskId"));
        assertEquals("c1", MDC.get("connectionId"));
    }

    @Test
    @DisplayName("clear removes all keelson MDC keys")
    void clear() {
        MdcContext.setTask(new TaskKey(1, 1));
        MdcContext.setRequest("c1", "r1");
        MdcContext.clear();
        assertNull(MDC.get("workdirId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("connectionId"));
        assertNull(MDC.get("requestId"));
    }
}
