package de.mirkosertic.mcp.toolsearch;

import java.util.List;

/**
 * Turns arbitrary text into the ordered sequence of index terms used for scoring.
 *
 * <p>Implementations are total and deterministic: the same text always yields the same
 * tokens, duplicates are kept in order of occurrence, and every token is lowercase,
 * ASCII alphanumeric and at least three characters long.</p>
 */
public interface TextTokenizer {

    /**
     * Tokenize the given text.
     *
     * @param text the text to tokenize, may be empty
     * @return the tokens in order of occurrence, never null
     */
    List<String> tokenize(String text);
}
