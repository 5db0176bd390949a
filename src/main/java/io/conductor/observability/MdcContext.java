package io.conductor.observability;

import org.slf4j.MDC;

/**
 * MDC keys attached to log lines emitted while a task is being executed or reported.
 */
public final class MdcContext {
    public static final String TASK_ID = "taskId";
    public static final String AGENT_KIND = "agentKind";

    private MdcContext() {
    }

    public static void setTask(String taskId, String agentKind) {
        MDC.put(TASK_ID, taskId);
        if (agentKind != null) {
            MDC.put(AGENT_KIND, agentKind);
        }
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_KIND);
    }
}
