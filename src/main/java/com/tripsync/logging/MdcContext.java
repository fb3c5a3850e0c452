package com.tripsync.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * MDC keys used to correlate the log lines of one request, including those written by
 * executor worker threads.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String STAGE = "stage";
    public static final String TASK_ID = "taskId";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setStage(String sessionId, String stage) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(STAGE, stage);
    }

    public static void setTask(String taskId) {
        MDC.put(TASK_ID, taskId);
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(STAGE);
        MDC.remove(TASK_ID);
    }

    /**
     * Wraps {@code task} so that it runs with the caller's MDC on whatever thread executes it.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            } else {
                MDC.clear();
            }
            try {
                task.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
