package de.mirkosertic.mcp.toolsearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.miscellaneous.LengthFilter;
import org.apache.lucene.analysis.pattern.PatternTokenizer;

import java.util.regex.Pattern;

/**
 * Analyzer producing the index terms used for tool names, descriptions and queries.
 *
 * <p>Input is expected to be lower-cased already (see {@link AnalyzerTextTokenizer}). Every
 * character outside {@code [a-z0-9]} separates tokens, and tokens shorter than
 * {@value #MIN_TOKEN_LENGTH} characters are dropped. There is no stemming and no stop word
 * list; the length filter is the only pruning.</p>
 */
public class ToolTextAnalyzer extends Analyzer {

    public static final int MIN_TOKEN_LENGTH = 3;

    private static final Pattern SEPARATOR = Pattern.compile("[^a-z0-9]+");

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        // group -1 splits on the pattern instead of matching it
        final Tokenizer tokenizer = new PatternTokenizer(SEPARATOR, -1);
        final TokenStream stream = new LengthFilter(tokenizer, MIN_TOKEN_LENGTH, Integer.MAX_VALUE);
        return new TokenStreamComponents(tokenizer, stream);
    }
}
