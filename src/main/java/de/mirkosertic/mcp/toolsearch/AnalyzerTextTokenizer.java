package de.mirkosertic.mcp.toolsearch;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link TextTokenizer} backed by the {@link ToolTextAnalyzer}.
 *
 * <p>The whole text is lower-cased with {@link Locale#ROOT} before analysis, so characters
 * whose lowercase form is ASCII (for example the Kelvin sign) still produce letters.</p>
 */
public class AnalyzerTextTokenizer implements TextTokenizer {

    private static final String FIELD_NAME = "text";

    private final Analyzer analyzer;

    public AnalyzerTextTokenizer() {
        this(new ToolTextAnalyzer());
    }

    AnalyzerTextTokenizer(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public List<String> tokenize(final String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        final List<String> tokens = new ArrayList<>();
        try (final TokenStream stream = analyzer.tokenStream(FIELD_NAME, text.toLowerCase(Locale.ROOT))) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (final IOException e) {
            // Analysis runs on an in-memory StringReader
            throw new UncheckedIOException("Failed to tokenize text", e);
        }
        return List.copyOf(tokens);
    }
}
