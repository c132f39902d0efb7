package de.mirkosertic.mcp.toolsearch;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A scored catalog entry carrying the fields the ranker uses to break score ties.
 *
 * @param entry          the catalog entry
 * @param score          raw BM25 score
 * @param matchedTokens  distinct matched terms in first-seen order
 * @param nameMatchCount number of matched terms that also occur in the tool name
 */
public record ScoredTool(
        CatalogEntry entry,
        double score,
        List<String> matchedTokens,
        int nameMatchCount
) {
    /**
     * Combine a document score with the tokens of the tool name.
     */
    public static ScoredTool of(final CatalogEntry entry, final List<String> nameTokens,
                                final Bm25Scorer.DocumentScore documentScore) {
        final Set<String> names = new HashSet<>(nameTokens);
        int nameMatches = 0;
        for (final String token : documentScore.matchedTerms()) {
            if (names.contains(token)) {
                nameMatches++;
            }
        }
        return new ScoredTool(entry, documentScore.score(), documentScore.matchedTerms(), nameMatches);
    }

    public boolean hasNameMatch() {
        return nameMatchCount > 0;
    }

    public int nameLength() {
        return entry.tool().name().length();
    }

    public SearchResult toResult() {
        return new SearchResult(entry.server(), entry.tool(), score, matchedTokens);
    }
}
