package de.mirkosertic.mcp.toolsearch;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Term statistics of the documents considered in one search call.
 *
 * <p>Document frequencies are computed once through an inverted term count, which yields
 * the same values as scanning every document per term. The statistics are a snapshot:
 * later changes to the document lists passed in do not affect them.</p>
 */
public final class CorpusStatistics {

    private final int numDocs;
    private final double averageLength;
    private final Map<String, Integer> documentFrequencies;

    private CorpusStatistics(final int numDocs, final double averageLength,
                             final Map<String, Integer> documentFrequencies) {
        this.numDocs = numDocs;
        this.averageLength = averageLength;
        this.documentFrequencies = documentFrequencies;
    }

    /**
     * Build statistics for the given token sequences, one per document.
     */
    public static CorpusStatistics of(final List<List<String>> documents) {
        final Map<String, Integer> frequencies = new HashMap<>();
        long totalLength = 0;

        for (final List<String> document : documents) {
            totalLength += document.size();
            final Set<String> distinct = new HashSet<>(document);
            for (final String term : distinct) {
                frequencies.merge(term, 1, Integer::sum);
            }
        }

        final int numDocs = documents.size();
        final double averageLength = numDocs == 0 ? 0.0 : (double) totalLength / numDocs;
        return new CorpusStatistics(numDocs, averageLength, Map.copyOf(frequencies));
    }

    public int numDocs() {
        return numDocs;
    }

    /**
     * Mean number of tokens per document, 0 for an empty corpus.
     */
    public double averageLength() {
        return averageLength;
    }

    /**
     * Number of documents containing the term at least once.
     */
    public int documentFrequency(final String term) {
        return documentFrequencies.getOrDefault(term, 0);
    }

    /**
     * Number of distinct terms in the corpus.
     */
    public int vocabularySize() {
        return documentFrequencies.size();
    }
}
