package com.sqlmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * A named tool invocation with its arguments. The arguments are copied on construction and never mutated.
 *
 * @param tool The resolved tool
 * @param arguments The caller supplied arguments as a JSON object
 */
public record ToolRequest(ToolName tool, ObjectNode arguments) {
    public ToolRequest {
        if (tool == null) {
            throw new IllegalArgumentException("Tool cannot be null");
        }
        arguments = arguments == null ? JsonNodeFactory.instance.objectNode() : arguments.deepCopy();
    }

    /**
     * Builds a request from raw JSON-RPC arguments. Anything other than an object is treated as no arguments
     * and left for validation to reject where the tool needs them.
     */
    public static ToolRequest of(ToolName tool, JsonNode rawArguments) {
        if (rawArguments instanceof ObjectNode objectNode) {
            return new ToolRequest(tool, objectNode);
        }
        return new ToolRequest(tool, null);
    }

    public boolean has(String argumentName) {
        JsonNode argumentNode = arguments.get(argumentName);
        return argumentNode != null && !argumentNode.isNull();
    }

    public JsonNode argument(String argumentName) {
        return arguments.path(argumentName);
    }

    public Optional<String> text(String argumentName) {
        return has(argumentName) ? Optional.of(arguments.get(argumentName).asText()) : Optional.empty();
    }

    public boolean flag(String argumentName, boolean defaultValue) {
        return has(argumentName) ? arguments.get(argumentName).asBoolean(defaultValue) : defaultValue;
    }
}
