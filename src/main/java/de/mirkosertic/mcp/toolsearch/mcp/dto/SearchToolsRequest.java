package de.mirkosertic.mcp.toolsearch.mcp.dto;

import de.mirkosertic.mcp.toolsearch.SearchOptions;
import de.mirkosertic.mcp.toolsearch.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Request DTO for the searchTools tool.
 */
public record SearchToolsRequest(
        @Description("Natural-language description of what the tool should do, e.g. 'read a file from disk'.")
        String query,

        @Nullable
        @Description("Minimum relevance score (inclusive). Default is 0.3. Scores are raw BM25 values, not percentages.")
        Double threshold,

        @Nullable
        @Description("Maximum number of results. Default is 10, maximum is 100.")
        Integer limit,

        @Nullable
        @Description("Expand the query with synonyms such as 'remove' for 'delete'. Default is true.")
        Boolean useSynonyms
) {
    public static final int MAX_LIMIT = 100;

    /**
     * Create a SearchToolsRequest from a Map of arguments.
     *
     * @throws IllegalArgumentException if an argument has the wrong type
     */
    public static SearchToolsRequest fromMap(final Map<String, Object> args) {
        return new SearchToolsRequest(
                optional(args, "query", String.class),
                args.get("threshold") != null ? optional(args, "threshold", Number.class).doubleValue() : null,
                args.get("limit") != null ? boundedLimit(optional(args, "limit", Number.class)) : null,
                optional(args, "useSynonyms", Boolean.class)
        );
    }

    private static int boundedLimit(final Number limit) {
        final long value = limit.longValue();
        return (int) Math.max(Integer.MIN_VALUE, Math.min(value, MAX_LIMIT));
    }

    private static <T> @Nullable T optional(final Map<String, Object> args, final String key, final Class<T> type) {
        final Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Argument '" + key + "' must be a "
                    + type.getSimpleName().toLowerCase(Locale.ROOT) + " but was " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    /**
     * Get the effective query, an empty string when none was given.
     */
    public String effectiveQuery() {
        return query != null ? query : "";
    }

    /**
     * Merge the request parameters over the configured defaults. The limit is capped at
     * {@value #MAX_LIMIT}; negative values are clamped by {@link SearchOptions}.
     */
    public SearchOptions toOptions(final SearchOptions defaults) {
        return new SearchOptions(
                threshold != null ? threshold : defaults.threshold(),
                limit != null ? Math.min(limit, MAX_LIMIT) : defaults.limit(),
                useSynonyms != null ? useSynonyms : defaults.useSynonyms()
        );
    }
}
