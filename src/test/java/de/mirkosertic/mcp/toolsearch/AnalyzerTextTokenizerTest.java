package de.mirkosertic.mcp.toolsearch;

import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalyzerTextTokenizer} and {@link ToolTextAnalyzer}.
 */
@DisplayName("AnalyzerTextTokenizer")
class AnalyzerTextTokenizerTest {

    private final AnalyzerTextTokenizer tokenizer = new AnalyzerTextTokenizer();

    @Test
    @DisplayName("Sentence is lower-cased and short words are dropped")
    void sentence() {
        assertThat(tokenizer.tokenize("Read a file from disk")).containsExactly("read", "file", "from", "disk");
    }

    @Test
    @DisplayName("Underscores and punctuation separate tokens")
    void separators() {
        assertThat(tokenizer.tokenize("read_file")).containsExactly("read", "file");
        assertThat(tokenizer.tokenize("Hello, World! FOO-bar/baz.qux")).containsExactly("hello", "world", "foo", "bar", "baz", "qux");
    }

    @Test
    @DisplayName("Digits are kept, tokens of two characters are not")
    void digits() {
        assertThat(tokenizer.tokenize("v2 api3 x11 2024")).containsExactly("api3", "x11", "2024");
    }

    @Test
    @DisplayName("Duplicates are kept in order")
    void duplicates() {
        assertThat(tokenizer.tokenize("file FILE File")).containsExactly("file", "file", "file");
    }

    @Test
    @DisplayName("Only short words yield no tokens")
    void onlyShortWords() {
        assertThat(tokenizer.tokenize("ab cd")).isEmpty();
        assertThat(tokenizer.tokenize("a b c to of")).isEmpty();
    }

    @Test
    @DisplayName("Empty and null input yield no tokens")
    void emptyInput() {
        assertThat(tokenizer.tokenize("")).isEmpty();
        assertThat(tokenizer.tokenize(null)).isEmpty();
        assertThat(tokenizer.tokenize("   \t\n ")).isEmpty();
    }

    @Test
    @DisplayName("Non-ASCII letters separate tokens")
    void nonAsciiLetters() {
        // é and ï are separators, leaving "caf", "na" and "ve"
        assertThat(tokenizer.tokenize("Café naïve")).containsExactly("caf");
        assertThat(tokenizer.tokenize("Straße")).containsExactly("stra");
    }

    @Test
    @DisplayName("Lower-casing happens before splitting")
    void lowerCaseBeforeSplitting() {
        // KELVIN SIGN lower-cases to an ASCII 'k'
        assertThat(tokenizer.tokenize("\u212Aey")).containsExactly("key");
    }

    @Test
    @DisplayName("Tokenizing joined tokens again is idempotent")
    void idempotent() {
        final List<String> inputs = List.of(
                "Read a file from disk",
                "Download a resource from a URL!!",
                "create_pull_request: Create a new PR in GitHub (v3 API)",
                "Ünïcödé ÀND ascii 123 mixed___separators",
                "ab cd");

        for (final String input : inputs) {
            final List<String> tokens = tokenizer.tokenize(input);
            assertThat(tokenizer.tokenize(String.join(" ", tokens)))
                    .as("Re-tokenizing '%s'", input)
                    .isEqualTo(tokens);
        }
    }

    @Test
    @DisplayName("Every token is lowercase ASCII alphanumeric with at least 3 characters")
    void tokenShape() {
        final List<String> tokens = tokenizer.tokenize(
                "The QUICK brown-fox_jumps over 2 lazy dogs; ÉTÉ été 42 x1 y22 z333 ~!@#$%^&*() Tab\tNewline\n");

        assertThat(tokens).isNotEmpty().allMatch(token -> token.matches("[a-z0-9]{3,}"));
    }

    @Test
    @DisplayName("Analyzer alone splits lower-case input and filters by length")
    void analyzerDirectly() throws IOException {
        final List<String> tokens = new ArrayList<>();
        try (final ToolTextAnalyzer analyzer = new ToolTextAnalyzer();
             final TokenStream stream = analyzer.tokenStream("text", "list_directory in a folder")) {
            final CharTermAttribute attr = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(attr.toString());
            }
            stream.end();
        }
        assertThat(tokens).containsExactly("list", "directory", "folder");
    }
}
