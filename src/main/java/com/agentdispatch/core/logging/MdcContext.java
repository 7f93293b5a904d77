package com.agentdispatch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing dispatch-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_ID = "agentId";
    public static final String PHASE = "phase";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setTask(String sessionId, String taskId, String agentId) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(TASK_ID, taskId);
        MDC.put(AGENT_ID, agentId);
    }

    public static void setPhase(String sessionId, String phase) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(PHASE, phase);
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_ID);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_ID);
        MDC.remove(PHASE);
    }
}
