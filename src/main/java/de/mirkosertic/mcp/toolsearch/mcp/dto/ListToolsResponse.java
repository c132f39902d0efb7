package de.mirkosertic.mcp.toolsearch.mcp.dto;

import de.mirkosertic.mcp.toolsearch.CatalogEntry;
import de.mirkosertic.mcp.toolsearch.mcp.ToolResultHelper;

import java.util.List;

/**
 * Response DTO for the listTools tool.
 */
public record ListToolsResponse(
        boolean success,
        List<ToolSummary> tools,
        int totalTools,
        List<String> servers,
        String error
) implements ToolResultHelper.Failable {

    /**
     * A catalog entry without scoring information.
     */
    public record ToolSummary(String server, String name, String description) {

        public static ToolSummary from(final CatalogEntry entry) {
            return new ToolSummary(entry.server(), entry.tool().name(), entry.tool().description());
        }
    }

    public static ListToolsResponse success(final List<CatalogEntry> entries, final List<String> servers) {
        final List<ToolSummary> tools = entries.stream().map(ToolSummary::from).toList();
        return new ListToolsResponse(true, tools, tools.size(), servers, null);
    }

    public static ListToolsResponse error(final String errorMessage) {
        return new ListToolsResponse(false, null, 0, null, errorMessage);
    }
}
