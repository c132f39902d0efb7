package de.mirkosertic.mcp.toolsearch.mcp.dto;

import de.mirkosertic.mcp.toolsearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the listTools tool.
 */
public record ListToolsRequest(
        @Nullable
        @Description("Only list the tools of this server. Lists all servers when omitted.")
        String server
) {
    public static ListToolsRequest fromMap(final Map<String, Object> args) {
        final Object server = args.get("server");
        return new ListToolsRequest(server != null ? server.toString() : null);
    }

    public boolean hasServerFilter() {
        return server != null && !server.isBlank();
    }
}
