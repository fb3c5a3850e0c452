package com.tripsync.execution;

/**
 * A tool call failed. Never escapes the {@link TaskExecutor}: it becomes a failed {@link TaskResult}.
 */
public class ToolExecutionException extends RuntimeException {

    private final String toolName;
    private final boolean retryable;

    public ToolExecutionException(String toolName, String message, boolean retryable) {
        super(message);
        this.toolName = toolName;
        this.retryable = retryable;
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
        this.retryable = true;
    }

    public static ToolExecutionException unknownTool(String toolName) {
        return new ToolExecutionException(toolName, "Tool not found: " + toolName, false);
    }

    public String getToolName() {
        return toolName;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
