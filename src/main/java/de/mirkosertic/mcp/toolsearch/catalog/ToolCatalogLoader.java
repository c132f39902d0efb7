package de.mirkosertic.mcp.toolsearch.catalog;

import de.mirkosertic.mcp.toolsearch.CatalogEntry;
import de.mirkosertic.mcp.toolsearch.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a tool catalog from YAML.
 * <p>
 * Expected layout:
 * <pre>
 * servers:
 *   filesystem:
 *     tools:
 *       - name: read_file
 *         description: Read a file from disk
 *       - name: list_directory
 * </pre>
 * Entries keep the order of the file. Unknown keys are ignored. Malformed entries are
 * rejected with a {@link CatalogValidationException} naming the offending node.
 */
public class ToolCatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(ToolCatalogLoader.class);

    /**
     * Load a catalog file.
     *
     * @throws IOException                if the file cannot be read or is not valid YAML
     * @throws CatalogValidationException if an entry is malformed
     */
    public List<CatalogEntry> load(final Path path) throws IOException {
        try (final Reader reader = Files.newBufferedReader(path)) {
            final List<CatalogEntry> entries = load(reader);
            logger.info("Loaded {} tools from {}", entries.size(), path);
            return entries;
        }
    }

    /**
     * Load a catalog from a reader.
     */
    public List<CatalogEntry> load(final Reader reader) throws IOException {
        final Object document;
        try {
            document = new Yaml().load(reader);
        } catch (final YAMLException e) {
            throw new IOException("Invalid catalog YAML: " + e.getMessage(), e);
        }
        return parse(document);
    }

    List<CatalogEntry> parse(final Object document) {
        if (document == null) {
            return List.of();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new CatalogValidationException("catalog", "must be a mapping with a 'servers' section");
        }

        final Object servers = root.get("servers");
        if (servers == null) {
            return List.of();
        }
        if (!(servers instanceof Map<?, ?> serverMap)) {
            throw new CatalogValidationException("servers", "must be a mapping of server identifiers");
        }

        final List<CatalogEntry> entries = new ArrayList<>();
        for (final Map.Entry<?, ?> serverEntry : serverMap.entrySet()) {
            final String server = requireServerId(serverEntry.getKey());
            parseServer(server, serverEntry.getValue(), entries);
        }
        return List.copyOf(entries);
    }

    private void parseServer(final String server, final Object value, final List<CatalogEntry> entries) {
        final String location = "servers." + server;
        if (value == null) {
            return;
        }
        if (!(value instanceof Map<?, ?> serverConfig)) {
            throw new CatalogValidationException(location, "must be a mapping with a 'tools' list");
        }

        final Object tools = serverConfig.get("tools");
        if (tools == null) {
            return;
        }
        if (!(tools instanceof List<?> toolList)) {
            throw new CatalogValidationException(location + ".tools", "must be a list");
        }

        for (int i = 0; i < toolList.size(); i++) {
            entries.add(new CatalogEntry(server, parseTool(location + ".tools[" + i + "]", toolList.get(i))));
        }
    }

    private ToolDescriptor parseTool(final String location, final Object value) {
        if (!(value instanceof Map<?, ?> tool)) {
            throw new CatalogValidationException(location, "must be a mapping with 'name' and optional 'description'");
        }

        final Object name = tool.get("name");
        if (!(name instanceof String nameString) || nameString.isBlank()) {
            throw new CatalogValidationException(location + ".name", "must be a non-blank string but was " + describe(name));
        }

        final Object description = tool.get("description");
        if (description != null && !(description instanceof String)) {
            throw new CatalogValidationException(location + ".description", "must be a string but was " + describe(description));
        }

        return new ToolDescriptor(nameString, (String) description);
    }

    private static String requireServerId(final Object key) {
        if (!(key instanceof String server) || server.isBlank()) {
            throw new CatalogValidationException("servers", "keys must be non-blank strings but found " + describe(key));
        }
        return server;
    }

    private static String describe(final Object value) {
        if (value == null) {
            return "missing";
        }
        if (value instanceof String s) {
            return "'" + s + "'";
        }
        return value.getClass().getSimpleName() + " '" + value + "'";
    }
}
