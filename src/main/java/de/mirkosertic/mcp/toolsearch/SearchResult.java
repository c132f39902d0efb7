package de.mirkosertic.mcp.toolsearch;

import java.util.List;

/**
 * A ranked search hit.
 *
 * @param server        identifier of the server providing the tool
 * @param tool          the matching tool
 * @param score         raw BM25 score, only comparable within one result set
 * @param matchedTokens distinct matched terms (exact and synonym) in first-seen order
 */
public record SearchResult(
        String server,
        ToolDescriptor tool,
        double score,
        List<String> matchedTokens
) {
}
