package com.tripsync.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.tripsync.state.model.Task;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Tool call planned on a task, read from {@code metadata.tool} and {@code metadata.arguments}.
 */
public record ToolInvocation(String toolName, JsonNode arguments) {

    public static final String METADATA_TOOL = "tool";
    public static final String METADATA_ARGUMENTS = "arguments";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ToolInvocation {
        arguments = arguments == null || arguments.isNull() ? JsonNodeFactory.instance.objectNode() : arguments;
    }

    public static Optional<ToolInvocation> fromTask(Task task) {
        Object tool = task.metadataValue(METADATA_TOOL);
        if (!(tool instanceof String name) || !StringUtils.hasText(name)) {
            return Optional.empty();
        }
        Object rawArguments = task.metadataValue(METADATA_ARGUMENTS);
        JsonNode arguments;
        if (rawArguments instanceof String text && StringUtils.hasText(text)) {
            try {
                arguments = MAPPER.readTree(text);
            } catch (JsonProcessingException ex) {
                arguments = JsonNodeFactory.instance.textNode(text);
            }
        } else {
            arguments = MAPPER.valueToTree(rawArguments);
        }
        return Optional.of(new ToolInvocation(name.trim(), arguments));
    }

    public String argumentsJson() {
        return arguments.toString();
    }
}
