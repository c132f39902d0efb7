package de.mirkosertic.mcp.toolsearch;

import de.mirkosertic.mcp.toolsearch.catalog.ToolCatalogService;
import de.mirkosertic.mcp.toolsearch.config.BuildInfo;
import de.mirkosertic.mcp.toolsearch.mcp.SchemaGenerator;
import de.mirkosertic.mcp.toolsearch.mcp.ToolResultHelper;
import de.mirkosertic.mcp.toolsearch.mcp.dto.ListToolsRequest;
import de.mirkosertic.mcp.toolsearch.mcp.dto.ListToolsResponse;
import de.mirkosertic.mcp.toolsearch.mcp.dto.ReloadCatalogResponse;
import de.mirkosertic.mcp.toolsearch.mcp.dto.SearchStatsResponse;
import de.mirkosertic.mcp.toolsearch.mcp.dto.SearchToolsRequest;
import de.mirkosertic.mcp.toolsearch.mcp.dto.SearchToolsResponse;
import de.mirkosertic.mcp.toolsearch.mcp.dto.ToolHit;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MCP tools for searching the tool catalog.
 * Provides search, catalog listing, catalog reload and runtime statistics.
 */
public class ToolSearchTools {

    private static final Logger logger = LoggerFactory.getLogger(ToolSearchTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Find the tools best suited for a task by describing the task in plain words, \
            e.g. 'read a file from disk' or 'create a github issue'. \
            Matching is LEXICAL: tool names and descriptions are compared word by word (words shorter than 3 characters are ignored). \
            Common synonyms are added automatically (e.g. 'remove' also finds 'delete') but count less than the words you typed. \
            There is no stemming: 'files' does not match 'file', so include the word forms you expect. \
            Words found in a tool's name rank that tool higher than words found only in its description. \
            Returns: tools ordered by relevance with server, name, description, raw BM25 score, \
            relevance relative to the best hit (0-1) and the matched words.""";

    private final ToolCatalogService catalogService;
    private final HybridToolSearcher searcher;
    private final SearchOptions defaultOptions;
    private final SearchRuntimeStats runtimeStats;
    private final TokenizerCacheStats tokenizerStats;

    public ToolSearchTools(final ToolCatalogService catalogService,
                           final HybridToolSearcher searcher,
                           final SearchOptions defaultOptions,
                           final SearchRuntimeStats runtimeStats,
                           final TokenizerCacheStats tokenizerStats) {
        this.catalogService = catalogService;
        this.searcher = searcher;
        this.defaultOptions = defaultOptions;
        this.runtimeStats = runtimeStats;
        this.tokenizerStats = tokenizerStats;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("searchTools")
                        .description(SEARCH_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(SearchToolsRequest.class))
                        .build())
                .callHandler((exchange, request) -> searchTools(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("listTools")
                        .description("List the tools in the catalog with their server and description, " +
                                "optionally restricted to one server.")
                        .inputSchema(SchemaGenerator.generateSchema(ListToolsRequest.class))
                        .build())
                .callHandler((exchange, request) -> listTools(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("reloadCatalog")
                        .description("Reload the tool catalog file. If the file is invalid the current catalog stays active " +
                                "and the validation error is returned.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> reloadCatalog())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getSearchStats")
                        .description("Get runtime statistics of the search: number of searches, durations with percentiles, " +
                                "average result count and tokenizer cache hit rate.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getSearchStats())
                .build());

        return tools;
    }

    // Tool implementation methods
    McpSchema.CallToolResult searchTools(final Map<String, Object> args) {
        final SearchToolsRequest request;
        try {
            request = SearchToolsRequest.fromMap(args != null ? args : Map.of());
        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid search request: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchToolsResponse.error("Invalid request: " + e.getMessage()));
        }

        final SearchOptions options = request.toOptions(defaultOptions);
        logger.info("Search request: query='{}', threshold={}, limit={}, useSynonyms={}",
                request.query(), options.threshold(), options.limit(), options.useSynonyms());

        try {
            final List<CatalogEntry> catalog = catalogService.getEntries();

            final long startTime = System.nanoTime();
            final List<SearchResult> results = searcher.search(request.effectiveQuery(), catalog, options);
            final long durationMicros = (System.nanoTime() - startTime) / 1_000;
            runtimeStats.recordSearch(durationMicros, results.size());

            // Tie-breaking within the score epsilon can rank a slightly lower score first
            final double bestScore = results.stream().mapToDouble(SearchResult::score).max().orElse(0.0);
            final List<ToolHit> hits = results.stream()
                    .map(result -> ToolHit.from(result, bestScore))
                    .toList();

            logger.info("Search completed in {}us: {} of {} tools returned", durationMicros, hits.size(), catalog.size());

            return ToolResultHelper.createResult(SearchToolsResponse.success(hits, catalog.size(), durationMicros / 1000.0));

        } catch (final RuntimeException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchToolsResponse.error("Search error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult listTools(final Map<String, Object> args) {
        final ListToolsRequest request = ListToolsRequest.fromMap(args != null ? args : Map.of());

        logger.info("List tools request: server='{}'", request.server());

        final List<CatalogEntry> entries = request.hasServerFilter()
                ? catalogService.getTools(request.server())
                : catalogService.getEntries();

        if (request.hasServerFilter() && entries.isEmpty()) {
            return ToolResultHelper.createResult(ListToolsResponse.error("Unknown server: " + request.server()));
        }

        final List<String> servers = entries.stream().map(CatalogEntry::server).distinct().toList();
        logger.info("Listed {} tools from {} servers", entries.size(), servers.size());

        return ToolResultHelper.createResult(ListToolsResponse.success(entries, servers));
    }

    McpSchema.CallToolResult reloadCatalog() {
        logger.info("Reload catalog request");

        try {
            final int toolCount = catalogService.reload();
            return ToolResultHelper.createResult(ReloadCatalogResponse.success(
                    toolCount, catalogService.getServers().size(), catalogService.getCatalogPath().toString()));

        } catch (final IllegalArgumentException e) {
            logger.warn("Catalog rejected: {}", e.getMessage());
            return ToolResultHelper.createResult(ReloadCatalogResponse.error("Invalid catalog: " + e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error reloading catalog", e);
            return ToolResultHelper.createResult(ReloadCatalogResponse.error("Error reloading catalog: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getSearchStats() {
        logger.info("Search stats request");

        final SearchStatsResponse response = SearchStatsResponse.success(
                runtimeStats, tokenizerStats, catalogService.getEntries().size(), BuildInfo.getVersion());

        logger.info("Search stats: searches={}, avg={}us", response.totalSearches(), response.averageDurationMicros());

        return ToolResultHelper.createResult(response);
    }
}
