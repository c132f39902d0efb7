package de.mirkosertic.mcp.toolsearch;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * BM25 relevance scoring with synonym weighting.
 *
 * <p>For every term of the expanded query (in order, duplicates included) that occurs in
 * the document, the score grows by {@code weight * idf * saturatedTf} where</p>
 * <ul>
 *   <li>{@code idf = ln((N - df + 0.5) / (df + 0.5) + 1)}, always positive</li>
 *   <li>{@code saturatedTf = tf * (k1 + 1) / (tf + k1 * (1 - b + b * dl / avgdl))}</li>
 *   <li>{@code weight} is 1.0 for original query terms and {@value #SYNONYM_WEIGHT} for
 *       synonym-derived terms</li>
 * </ul>
 * <p>The sum is not capped or normalized.</p>
 */
public class Bm25Scorer {

    public static final double K1 = 1.5;
    public static final double B = 0.75;
    public static final double EXACT_WEIGHT = 1.0;
    public static final double SYNONYM_WEIGHT = 0.7;

    /**
     * Score of one document together with the distinct terms that matched it.
     */
    public record DocumentScore(double score, List<String> matchedTerms) {

        public static final DocumentScore NONE = new DocumentScore(0.0, List.of());

        public boolean hasMatches() {
            return !matchedTerms.isEmpty();
        }
    }

    /**
     * Score a single document.
     *
     * @param query          the expanded query
     * @param documentTokens the document's token sequence (name tokens followed by description tokens)
     * @param corpus         statistics of the corpus the document belongs to
     * @return the score and matched terms in first-seen order
     */
    public DocumentScore score(final ExpandedQuery query, final List<String> documentTokens,
                               final CorpusStatistics corpus) {
        if (query.isEmpty() || documentTokens.isEmpty()) {
            return DocumentScore.NONE;
        }

        final Map<String, Integer> termFrequencies = termFrequencies(documentTokens);
        final int documentLength = documentTokens.size();

        double score = 0.0;
        final Set<String> matched = new LinkedHashSet<>();

        for (final String term : query.expandedTokens()) {
            final int tf = termFrequencies.getOrDefault(term, 0);
            if (tf == 0) {
                continue;
            }

            final double idf = idf(corpus.numDocs(), corpus.documentFrequency(term));
            final double weight = query.isOriginal(term) ? EXACT_WEIGHT : SYNONYM_WEIGHT;
            score += weight * idf * saturatedTermFrequency(tf, documentLength, corpus.averageLength());

            matched.add(term);
        }

        return new DocumentScore(score, List.copyOf(matched));
    }

    /**
     * Smoothed inverse document frequency. The {@code + 1} inside the logarithm keeps it
     * positive even for terms present in every document.
     */
    static double idf(final int numDocs, final int documentFrequency) {
        return Math.log((numDocs - documentFrequency + 0.5) / (documentFrequency + 0.5) + 1);
    }

    static double saturatedTermFrequency(final int tf, final int documentLength, final double averageLength) {
        if (averageLength <= 0) {
            // Only an empty corpus has no average length, and it has no documents to score
            return 0.0;
        }
        final double numerator = tf * (K1 + 1);
        final double denominator = tf + K1 * (1 - B + B * (documentLength / averageLength));
        return numerator / denominator;
    }

    private static Map<String, Integer> termFrequencies(final List<String> tokens) {
        final Map<String, Integer> frequencies = new HashMap<>();
        for (final String token : tokens) {
            frequencies.merge(token, 1, Integer::sum);
        }
        return frequencies;
    }
}
