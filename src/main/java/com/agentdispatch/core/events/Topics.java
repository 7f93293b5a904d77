package com.agentdispatch.core.events;

/**
 * Topic names and event types published by the engine.
 */
public final class Topics {

    public static final String DISPATCH_STARTED = "dispatch.started";
    public static final String DISPATCH_PHASE = "dispatch.phase";
    public static final String DISPATCH_PROGRESS = "dispatch.progress";
    public static final String DISPATCH_PAUSED = "dispatch.paused";
    public static final String DISPATCH_RESUMED = "dispatch.resumed";
    public static final String DISPATCH_FINISHED = "dispatch.finished";
    public static final String TASK_STATUS = "task.status";
    public static final String TASK_ARTIFACT = "task.artifact";
    public static final String AGENT_STATUS = "agent.status";
    public static final String CHECKPOINT_SAVED = "checkpoint.saved";

    private Topics() {}

    public static String dispatch(String sessionId) {
        return "dispatch." + sessionId;
    }

    public static String task(String taskId) {
        return "task." + taskId;
    }

    public static String agent(String agentId) {
        return "agent." + agentId;
    }

    public static String checkpoint(String sessionId) {
        return "checkpoint." + sessionId;
    }
}
