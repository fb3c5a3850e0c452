package com.tripsync.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ToolGateway} over the Spring AI tool callbacks registered in the context, either
 * directly as {@link ToolCallback} beans or through {@link ToolCallbackProvider}s.
 * <p>
 * A tool that answers with a JSON object carrying an {@code error} field has failed.
 */
@Component
@Slf4j
public class ToolCallbackGateway implements ToolGateway {

    private static final String ERROR_FIELD = "error";

    private final Map<String, ToolCallback> callbacks;
    private final ObjectMapper objectMapper;

    public ToolCallbackGateway(ObjectProvider<ToolCallbackProvider> providers,
                               ObjectProvider<ToolCallback> toolCallbacks,
                               ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        Map<String, ToolCallback> byName = new LinkedHashMap<>();
        providers.orderedStream().forEach(provider -> register(byName, provider.getToolCallbacks()));
        toolCallbacks.orderedStream().forEach(callback -> register(byName, new ToolCallback[]{callback}));
        this.callbacks = Collections.unmodifiableMap(byName);
        if (callbacks.isEmpty()) {
            log.warn("No tool callbacks registered. Planned tool calls will fail.");
        } else {
            log.info("Registered tools: {}", callbacks.keySet());
        }
    }

    public List<String> toolNames() {
        return List.copyOf(callbacks.keySet());
    }

    public Optional<ToolCallback> find(String toolName) {
        return Optional.ofNullable(callbacks.get(toolName));
    }

    @Override
    public String toolCatalog() {
        StringBuilder catalog = new StringBuilder();
        callbacks.forEach((name, callback) -> catalog.append("- ").append(name).append(": ")
                .append(callback.getToolDefinition().description()).append('\n')
                .append("  input schema: ").append(callback.getToolDefinition().inputSchema()).append('\n'));
        return catalog.toString();
    }

    @Override
    public String executeToolByName(String toolName, String argumentsJson) {
        if (!StringUtils.hasText(toolName)) {
            throw new ToolExecutionException(toolName, "Tool name is required", false);
        }
        ToolCallback callback = find(toolName).orElseThrow(() -> ToolExecutionException.unknownTool(toolName));
        String arguments = StringUtils.hasText(argumentsJson) ? argumentsJson : "{}";
        String output;
        try {
            output = callback.call(arguments);
        } catch (RuntimeException ex) {
            throw new ToolExecutionException(toolName, "Tool " + toolName + " failed: " + ex.getMessage(), ex);
        }
        String reported = reportedError(output);
        if (reported != null) {
            throw new ToolExecutionException(toolName, "Tool " + toolName + " reported an error: " + reported, false);
        }
        return output;
    }

    private String reportedError(String output) {
        if (!StringUtils.hasText(output)) {
            return null;
        }
        try {
            JsonNode tree = objectMapper.readTree(output);
            // some callbacks wrap their JSON result in a JSON string
            if (tree.isTextual()) {
                tree = objectMapper.readTree(tree.asText());
            }
            JsonNode error = tree.get(ERROR_FIELD);
            if (error == null || error.isNull()) {
                return null;
            }
            return error.isValueNode() ? error.asText() : error.toString();
        } catch (JsonProcessingException ex) {
            // plain-text output
            return null;
        }
    }

    private static void register(Map<String, ToolCallback> byName, ToolCallback[] callbacks) {
        if (callbacks == null) {
            return;
        }
        for (ToolCallback callback : callbacks) {
            String name = callback.getToolDefinition().name();
            if (byName.putIfAbsent(name, callback) != null) {
                log.warn("Duplicate tool name {}, keeping the first registration", name);
            }
        }
    }
}
