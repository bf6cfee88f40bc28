package com.sqlmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Final outcome of a tool call: a result on completion, a typed error otherwise.
 *
 * @param toolName The wire name the caller asked for
 * @param state Terminal request state
 * @param result Structured result, present only when completed
 * @param error Error detail, present only when rejected or failed
 */
public record ToolResponse(String toolName, RequestState state, JsonNode result, ToolError error) {

    /**
     * Error detail carried by a rejected or failed call.
     */
    public record ToolError(ErrorKind kind, String message) {
    }

    public static ToolResponse completed(ToolName tool, JsonNode result) {
        return new ToolResponse(tool.wireName(), RequestState.COMPLETED, result, null);
    }

    public static ToolResponse rejected(String toolName, ErrorKind kind, String message) {
        return new ToolResponse(toolName, RequestState.REJECTED, null, new ToolError(kind, message));
    }

    public static ToolResponse failed(ToolName tool, ErrorKind kind, String message) {
        return new ToolResponse(tool.wireName(), RequestState.FAILED, null, new ToolError(kind, message));
    }

    public boolean succeeded() {
        return state == RequestState.COMPLETED;
    }

    public ObjectNode toJson() {
        ObjectNode responseNode = JsonSupport.mapper().createObjectNode();
        responseNode.put("tool", toolName);
        responseNode.put("state", state.wireName());
        if (succeeded()) {
            responseNode.set("result", result);
        } else {
            ObjectNode errorNode = responseNode.putObject("error");
            errorNode.put("kind", error.kind().wireCode());
            errorNode.put("message", error.message());
        }
        return responseNode;
    }
}
