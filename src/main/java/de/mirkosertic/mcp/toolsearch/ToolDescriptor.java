package de.mirkosertic.mcp.toolsearch;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A searchable tool: its name and an optional free-text description.
 */
public record ToolDescriptor(
        String name,
        @Nullable String description
) {
    public ToolDescriptor {
        Objects.requireNonNull(name, "Tool name must not be null");
    }

    /**
     * Returns the description, or an empty string when the tool has none.
     */
    public String effectiveDescription() {
        return description != null ? description : "";
    }
}
