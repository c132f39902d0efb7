package de.mirkosertic.mcp.toolsearch;

import com.google.common.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link SynonymExpander} backed by groups of interchangeable terms.
 *
 * <p>Groups are read from YAML:</p>
 * <pre>
 * groups:
 *   - [delete, remove, erase]
 *   - [directory, folder]
 * </pre>
 *
 * <p>Group members are normalized with the same tokenizer as queries, so a member like
 * {@code "Sub-Directory"} contributes the terms {@code sub} and {@code directory}; members
 * that normalize to nothing are ignored. A query token is followed by every other member of
 * every group containing it, in group order. A term related to several query tokens is
 * emitted once per token and therefore counted once per token during scoring.</p>
 */
public class DictionarySynonymExpander implements SynonymExpander {

    private static final Logger logger = LoggerFactory.getLogger(DictionarySynonymExpander.class);

    public static final String DEFAULT_RESOURCE = "synonyms.yaml";

    private final Map<String, List<String>> related;

    private DictionarySynonymExpander(final Map<String, List<String>> related) {
        this.related = related;
    }

    /**
     * Build an expander from in-memory groups.
     */
    public static DictionarySynonymExpander fromGroups(final List<List<String>> groups, final TextTokenizer tokenizer) {
        final List<List<String>> normalizedGroups = new ArrayList<>();
        for (final List<String> group : groups) {
            final Set<String> members = new LinkedHashSet<>();
            for (final String member : group) {
                members.addAll(tokenizer.tokenize(member));
            }
            if (members.size() > 1) {
                normalizedGroups.add(new ArrayList<>(members));
            }
        }

        final Map<String, List<String>> related = new LinkedHashMap<>();
        for (final List<String> group : normalizedGroups) {
            for (final String member : group) {
                final List<String> others = related.computeIfAbsent(member, k -> new ArrayList<>());
                for (final String other : group) {
                    if (!other.equals(member)) {
                        others.add(other);
                    }
                }
            }
        }

        final Map<String, List<String>> immutable = new LinkedHashMap<>();
        related.forEach((term, others) -> immutable.put(term, List.copyOf(others)));

        logger.debug("Synonym dictionary built: {} groups, {} terms", normalizedGroups.size(), immutable.size());
        return new DictionarySynonymExpander(immutable);
    }

    /**
     * Load the dictionary bundled with the application.
     */
    public static DictionarySynonymExpander fromClasspath(final TextTokenizer tokenizer) throws IOException {
        final URL url = Resources.getResource(DEFAULT_RESOURCE);
        try (final Reader reader = new InputStreamReader(url.openStream(), StandardCharsets.UTF_8)) {
            return fromGroups(parseGroups(loadYaml(reader, url.toString()), url.toString()), tokenizer);
        }
    }

    /**
     * Load a dictionary from a YAML file.
     */
    public static DictionarySynonymExpander fromFile(final Path path, final TextTokenizer tokenizer) throws IOException {
        try (final Reader reader = Files.newBufferedReader(path)) {
            return fromGroups(parseGroups(loadYaml(reader, path.toString()), path.toString()), tokenizer);
        }
    }

    private static Object loadYaml(final Reader reader, final String source) throws IOException {
        try {
            return new Yaml().load(reader);
        } catch (final YAMLException e) {
            throw new IOException("Invalid synonym dictionary YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    static List<List<String>> parseGroups(final Object document, final String source) throws IOException {
        if (document == null) {
            return List.of();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new IOException("Synonym dictionary " + source + " must be a mapping with a 'groups' list");
        }
        final Object groups = root.get("groups");
        if (groups == null) {
            return List.of();
        }
        if (!(groups instanceof List<?> groupList)) {
            throw new IOException("'groups' in " + source + " must be a list");
        }

        final List<List<String>> result = new ArrayList<>(groupList.size());
        for (int i = 0; i < groupList.size(); i++) {
            if (!(groupList.get(i) instanceof List<?> members)) {
                throw new IOException("groups[" + i + "] in " + source + " must be a list of terms");
            }
            final List<String> group = new ArrayList<>(members.size());
            for (final Object member : members) {
                // YAML turns bare words like 'on' or numbers into non-strings
                group.add(String.valueOf(member));
            }
            result.add(group);
        }
        return result;
    }

    @Override
    public ExpandedQuery expand(final List<String> queryTokens) {
        final List<String> expanded = new ArrayList<>();
        for (final String token : queryTokens) {
            expanded.add(token);
            expanded.addAll(related.getOrDefault(token, List.of()));
        }
        return new ExpandedQuery(expanded, new LinkedHashSet<>(queryTokens));
    }

    /**
     * Terms related to the given term, empty if it is not in the dictionary.
     */
    public List<String> synonymsOf(final String term) {
        return related.getOrDefault(term, List.of());
    }

    public int termCount() {
        return related.size();
    }
}
