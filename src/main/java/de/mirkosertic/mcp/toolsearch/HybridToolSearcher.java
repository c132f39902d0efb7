package de.mirkosertic.mcp.toolsearch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keyword search over a tool catalog using BM25 scoring and synonym expansion.
 *
 * <p>Each call works on its own snapshot of the catalog:</p>
 * <ol>
 *   <li>tokenize the query and, if enabled, expand it with synonyms</li>
 *   <li>tokenize every tool as its name tokens followed by its description tokens</li>
 *   <li>compute corpus statistics for exactly these documents</li>
 *   <li>score every tool, with synonym matches weighted lower than exact matches</li>
 *   <li>filter by threshold, order with tie-breaking and return the top results</li>
 * </ol>
 *
 * <p>No state is kept between calls; concurrent calls are independent.</p>
 */
public class HybridToolSearcher {

    private static final Logger logger = LoggerFactory.getLogger(HybridToolSearcher.class);

    private final TextTokenizer tokenizer;
    private final SynonymExpander synonymExpander;
    private final Bm25Scorer scorer;
    private final ToolRanker ranker;

    public HybridToolSearcher(final TextTokenizer tokenizer, final SynonymExpander synonymExpander) {
        this(tokenizer, synonymExpander, new Bm25Scorer(), new ToolRanker());
    }

    HybridToolSearcher(final TextTokenizer tokenizer, final SynonymExpander synonymExpander,
                       final Bm25Scorer scorer, final ToolRanker ranker) {
        this.tokenizer = tokenizer;
        this.synonymExpander = synonymExpander;
        this.scorer = scorer;
        this.ranker = ranker;
    }

    /**
     * Search the given tools.
     *
     * @param query   natural-language query, may be empty
     * @param tools   the catalog to search
     * @param options threshold, limit and synonym toggle
     * @return ranked results, at most {@code options.limit()} entries
     */
    public List<SearchResult> search(final String query, final List<CatalogEntry> tools, final SearchOptions options) {
        Objects.requireNonNull(query, "Query must not be null");
        Objects.requireNonNull(tools, "Tools must not be null");
        Objects.requireNonNull(options, "Options must not be null");

        final ExpandedQuery expandedQuery = expandQuery(query, options.useSynonyms());
        if (expandedQuery.isEmpty() || tools.isEmpty()) {
            logger.debug("Nothing to score: {} query terms, {} tools",
                    expandedQuery.expandedTokens().size(), tools.size());
            return List.of();
        }

        final List<List<String>> nameTokens = new ArrayList<>(tools.size());
        final List<List<String>> documents = new ArrayList<>(tools.size());
        for (final CatalogEntry entry : tools) {
            final List<String> name = tokenizer.tokenize(entry.tool().name());
            final List<String> description = tokenizer.tokenize(entry.tool().effectiveDescription());

            final List<String> document = new ArrayList<>(name.size() + description.size());
            document.addAll(name);
            document.addAll(description);

            nameTokens.add(name);
            documents.add(document);
        }

        final CorpusStatistics corpus = CorpusStatistics.of(documents);

        final List<ScoredTool> scored = new ArrayList<>(tools.size());
        for (int i = 0; i < tools.size(); i++) {
            final Bm25Scorer.DocumentScore documentScore = scorer.score(expandedQuery, documents.get(i), corpus);
            scored.add(ScoredTool.of(tools.get(i), nameTokens.get(i), documentScore));
        }

        final List<SearchResult> results = ranker.rank(scored, options.threshold(), options.limit());

        logger.debug("Scored {} tools (avg length {}, {} distinct terms) for {} query terms ({} after expansion), returning {}",
                corpus.numDocs(), corpus.averageLength(), corpus.vocabularySize(),
                expandedQuery.originalTokens().size(), expandedQuery.expandedTokens().size(), results.size());

        return results;
    }

    /**
     * Search with the default options.
     */
    public List<SearchResult> search(final String query, final List<CatalogEntry> tools) {
        return search(query, tools, SearchOptions.defaults());
    }

    ExpandedQuery expandQuery(final String query, final boolean useSynonyms) {
        final List<String> queryTokens = tokenizer.tokenize(query);
        if (!useSynonyms || queryTokens.isEmpty()) {
            return ExpandedQuery.unexpanded(queryTokens);
        }
        return synonymExpander.expand(queryTokens);
    }
}
