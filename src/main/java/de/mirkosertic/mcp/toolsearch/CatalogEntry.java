package de.mirkosertic.mcp.toolsearch;

import java.util.Objects;

/**
 * A tool together with the identifier of the server that provides it.
 */
public record CatalogEntry(
        String server,
        ToolDescriptor tool
) {
    public CatalogEntry {
        Objects.requireNonNull(server, "Server identifier must not be null");
        Objects.requireNonNull(tool, "Tool must not be null");
    }

    public static CatalogEntry of(final String server, final String name, final String description) {
        return new CatalogEntry(server, new ToolDescriptor(name, description));
    }

    /**
     * Returns {@code <server>/<tool name>}, the key used for the final alphabetical tie-break.
     */
    public String path() {
        return server + "/" + tool.name();
    }
}
