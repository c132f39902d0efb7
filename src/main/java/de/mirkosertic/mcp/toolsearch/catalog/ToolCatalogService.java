package de.mirkosertic.mcp.toolsearch.catalog;

import de.mirkosertic.mcp.toolsearch.CatalogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Holds the tool catalog that searches run against.
 * <p>
 * The catalog is an immutable snapshot that is replaced as a whole, so a search always sees
 * a consistent catalog even while a reload is in progress. A failed reload keeps the
 * previous snapshot.
 */
public class ToolCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(ToolCatalogService.class);

    private final Path catalogPath;
    private final ToolCatalogLoader loader;

    private volatile List<CatalogEntry> entries = List.of();

    public ToolCatalogService(final Path catalogPath, final ToolCatalogLoader loader) {
        this.catalogPath = catalogPath;
        this.loader = loader;
    }

    /**
     * Load the catalog file. A missing file results in an empty catalog.
     */
    public void init() throws IOException {
        if (!Files.exists(catalogPath)) {
            logger.warn("Catalog file {} does not exist, starting with an empty catalog", catalogPath);
            entries = List.of();
            return;
        }
        reload();
    }

    /**
     * Reload the catalog file.
     *
     * @return the number of tools in the new catalog
     * @throws IOException                if the file cannot be read or parsed
     * @throws CatalogValidationException if an entry is malformed; the previous catalog stays active
     */
    public synchronized int reload() throws IOException {
        if (!Files.exists(catalogPath)) {
            throw new IOException("Catalog file does not exist: " + catalogPath);
        }
        final List<CatalogEntry> loaded = loader.load(catalogPath);
        entries = loaded;
        logger.info("Catalog now contains {} tools from {} servers", loaded.size(), getServers().size());
        return loaded.size();
    }

    /**
     * Replace the catalog with the given entries.
     */
    public void setEntries(final List<CatalogEntry> newEntries) {
        entries = List.copyOf(newEntries);
    }

    public List<CatalogEntry> getEntries() {
        return entries;
    }

    /**
     * Server identifiers in catalog order.
     */
    public Set<String> getServers() {
        final Set<String> servers = new LinkedHashSet<>();
        for (final CatalogEntry entry : entries) {
            servers.add(entry.server());
        }
        return servers;
    }

    /**
     * Entries of one server, empty if the server is unknown.
     */
    public List<CatalogEntry> getTools(final String server) {
        final List<CatalogEntry> tools = new ArrayList<>();
        for (final CatalogEntry entry : entries) {
            if (entry.server().equals(server)) {
                tools.add(entry);
            }
        }
        return tools;
    }

    public Path getCatalogPath() {
        return catalogPath;
    }
}
