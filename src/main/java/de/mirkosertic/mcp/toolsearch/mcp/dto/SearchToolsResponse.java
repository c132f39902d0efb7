package de.mirkosertic.mcp.toolsearch.mcp.dto;

import de.mirkosertic.mcp.toolsearch.mcp.ToolResultHelper;

import java.util.List;

/**
 * Response DTO for the searchTools tool.
 */
public record SearchToolsResponse(
        boolean success,
        List<ToolHit> results,
        int totalTools,
        double searchTimeMs,
        String error
) implements ToolResultHelper.Failable {

    public static SearchToolsResponse success(final List<ToolHit> results, final int totalTools,
                                              final double searchTimeMs) {
        return new SearchToolsResponse(true, results, totalTools, searchTimeMs, null);
    }

    public static SearchToolsResponse error(final String errorMessage) {
        return new SearchToolsResponse(false, null, 0, 0, errorMessage);
    }
}
