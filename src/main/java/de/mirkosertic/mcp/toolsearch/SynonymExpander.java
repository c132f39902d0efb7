package de.mirkosertic.mcp.toolsearch;

import java.util.List;

/**
 * Expands normalized query tokens with related terms.
 *
 * <p>The returned expanded sequence contains every input token plus zero or more related
 * terms, duplicates allowed. The original token set is exactly the set of input tokens.
 * Implementations must be pure and deterministic.</p>
 */
@FunctionalInterface
public interface SynonymExpander {

    /**
     * Expander that returns its input unchanged.
     */
    SynonymExpander IDENTITY = ExpandedQuery::unexpanded;

    ExpandedQuery expand(List<String> queryTokens);
}
