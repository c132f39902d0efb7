package de.mirkosertic.mcp.toolsearch.catalog;

/**
 * Thrown when a tool catalog contains an entry that cannot be searched, for example a tool
 * without a name or a description that is not text.
 */
public class CatalogValidationException extends IllegalArgumentException {

    private final String location;

    public CatalogValidationException(final String location, final String message) {
        super(location + " " + message);
        this.location = location;
    }

    /**
     * Path of the offending node, e.g. {@code servers.web.tools[0].description}.
     */
    public String getLocation() {
        return location;
    }
}
