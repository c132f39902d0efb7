package de.mirkosertic.mcp.toolsearch.mcp.dto;

import de.mirkosertic.mcp.toolsearch.mcp.ToolResultHelper;

/**
 * Response DTO for the reloadCatalog tool.
 */
public record ReloadCatalogResponse(
        boolean success,
        int toolCount,
        int serverCount,
        String catalogPath,
        String error
) implements ToolResultHelper.Failable {

    public static ReloadCatalogResponse success(final int toolCount, final int serverCount, final String catalogPath) {
        return new ReloadCatalogResponse(true, toolCount, serverCount, catalogPath, null);
    }

    public static ReloadCatalogResponse error(final String errorMessage) {
        return new ReloadCatalogResponse(false, 0, 0, null, errorMessage);
    }
}
