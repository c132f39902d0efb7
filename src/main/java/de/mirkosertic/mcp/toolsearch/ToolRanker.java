package de.mirkosertic.mcp.toolsearch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Filters scored tools by threshold, orders them and truncates the result.
 *
 * <p>Ordering, first distinguishing rule wins:</p>
 * <ol>
 *   <li>higher score, when the scores differ by more than {@value #SCORE_EPSILON}</li>
 *   <li>tools with a matched term in their name before description-only matches</li>
 *   <li>more matched terms in the name</li>
 *   <li>shorter tool name</li>
 *   <li>{@code server/name} in ascending lexicographic order</li>
 * </ol>
 */
public class ToolRanker {

    public static final double SCORE_EPSILON = 0.001;

    static final Comparator<ScoredTool> RANKING = ToolRanker::compare;

    /**
     * Rank the candidates.
     *
     * @param candidates scored tools in any order
     * @param threshold  minimum score, inclusive
     * @param limit      maximum number of results
     * @return at most {@code limit} results, best first
     */
    public List<SearchResult> rank(final List<ScoredTool> candidates, final double threshold, final int limit) {
        if (limit <= 0) {
            return List.of();
        }

        final List<ScoredTool> accepted = new ArrayList<>();
        for (final ScoredTool candidate : candidates) {
            if (candidate.score() >= threshold) {
                accepted.add(candidate);
            }
        }

        final List<ScoredTool> sorted = mergeSort(accepted);

        final int size = Math.min(limit, sorted.size());
        final List<SearchResult> results = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            results.add(sorted.get(i).toResult());
        }
        return results;
    }

    static int compare(final ScoredTool a, final ScoredTool b) {
        if (Math.abs(b.score() - a.score()) > SCORE_EPSILON) {
            return Double.compare(b.score(), a.score());
        }
        if (a.hasNameMatch() != b.hasNameMatch()) {
            return a.hasNameMatch() ? -1 : 1;
        }
        if (a.nameMatchCount() != b.nameMatchCount()) {
            return Integer.compare(b.nameMatchCount(), a.nameMatchCount());
        }
        if (a.nameLength() != b.nameLength()) {
            return Integer.compare(a.nameLength(), b.nameLength());
        }
        return a.entry().path().compareTo(b.entry().path());
    }

    /**
     * Stable top-down merge sort. The epsilon score comparison is not transitive, which
     * {@link List#sort} may reject with an exception on larger inputs.
     */
    static List<ScoredTool> mergeSort(final List<ScoredTool> items) {
        if (items.size() <= 1) {
            return new ArrayList<>(items);
        }
        final int middle = items.size() / 2;
        final List<ScoredTool> left = mergeSort(items.subList(0, middle));
        final List<ScoredTool> right = mergeSort(items.subList(middle, items.size()));

        final List<ScoredTool> merged = new ArrayList<>(items.size());
        int i = 0;
        int j = 0;
        while (i < left.size() && j < right.size()) {
            if (RANKING.compare(right.get(j), left.get(i)) < 0) {
                merged.add(right.get(j++));
            } else {
                merged.add(left.get(i++));
            }
        }
        while (i < left.size()) {
            merged.add(left.get(i++));
        }
        while (j < right.size()) {
            merged.add(right.get(j++));
        }
        return merged;
    }
}
