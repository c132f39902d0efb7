package de.mirkosertic.mcp.toolsearch.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;
import java.util.Map;

/**
 * Wraps response DTOs into MCP tool results.
 * <p>
 * Responses are serialized to JSON text content. A response record with a
 * {@code success} component set to {@code false} marks the result as an error.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    /**
     * Create a tool result from a response DTO.
     */
    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(response instanceof Failable failable && !failable.success())
                .build();
    }

    /**
     * Create an error result carrying only a message.
     */
    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(
                        toJson(Map.of("success", false, "error", errorMessage == null ? "" : errorMessage)))))
                .isError(true)
                .build();
    }

    /**
     * Serialize an object to JSON.
     */
    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            return "{\"success\":false,\"error\":\"JSON serialization error\"}";
        }
    }

    /**
     * Implemented by response records that report success or failure.
     */
    public interface Failable {
        boolean success();
    }
}
