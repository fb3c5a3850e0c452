package com.tripsync.execution;

/**
 * Boundary to the external tools (flights, hotels, rail, maps) that planned tasks call.
 */
public interface ToolGateway {

    /**
     * Invokes a tool by name.
     *
     * @param toolName      registered tool name
     * @param argumentsJson JSON object with the tool arguments
     * @return the raw tool output, usually JSON
     * @throws ToolExecutionException when the tool is unknown, throws, or reports an error
     */
    String executeToolByName(String toolName, String argumentsJson);

    /**
     * Human-readable list of the available tools and their input schemas, for agent prompts.
     */
    default String toolCatalog() {
        return "";
    }
}
