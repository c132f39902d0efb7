package de.mirkosertic.mcp.toolsearch;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.toolsearch.catalog.ToolCatalogLoader;
import de.mirkosertic.mcp.toolsearch.catalog.ToolCatalogService;
import de.mirkosertic.mcp.toolsearch.config.ApplicationConfig;
import de.mirkosertic.mcp.toolsearch.config.BuildInfo;
import de.mirkosertic.mcp.toolsearch.config.LoggingConfigurator;
import de.mirkosertic.mcp.toolsearch.mcp.LatestProtocolStdioServerTransportProvider;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Main entry point for the MCP Tool Search Server.
 * Loads the tool catalog and synonym dictionary and serves searches over STDIO.
 */
public class ToolsearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(ToolsearchApplication.class);

    private final ApplicationConfig config;
    private final TokenizerCacheStats tokenizerStats;
    private final TextTokenizer tokenizer;
    private final ToolCatalogService catalogService;
    private final SearchRuntimeStats runtimeStats;
    private ToolSearchTools searchTools;
    private McpSyncServer mcpServer;

    public ToolsearchApplication(final ApplicationConfig config) {
        this.config = config;
        this.tokenizerStats = new TokenizerCacheStats();
        this.tokenizer = new CachedTextTokenizer(new AnalyzerTextTokenizer(), config.getTokenizerCacheSize(), tokenizerStats);
        this.catalogService = new ToolCatalogService(config.getCatalogPath(), new ToolCatalogLoader());
        this.runtimeStats = new SearchRuntimeStats();
    }

    /**
     * Load the catalog and the synonym dictionary.
     */
    public void init() throws IOException {
        logger.info("Initializing MCP Tool Search Server {}...", BuildInfo.describe());

        catalogService.init();

        final SynonymExpander synonymExpander = loadSynonyms();
        final HybridToolSearcher searcher = new HybridToolSearcher(tokenizer, synonymExpander);

        this.searchTools = new ToolSearchTools(
                catalogService,
                searcher,
                config.getDefaultSearchOptions(),
                runtimeStats,
                tokenizerStats
        );

        logger.info("All services initialized successfully");
    }

    private SynonymExpander loadSynonyms() throws IOException {
        final Path synonymsPath = config.getSynonymsPath();
        final DictionarySynonymExpander expander = synonymsPath != null
                ? DictionarySynonymExpander.fromFile(synonymsPath, tokenizer)
                : DictionarySynonymExpander.fromClasspath(tokenizer);
        logger.info("Synonym dictionary loaded from {} with {} terms",
                synonymsPath != null ? synonymsPath : DictionarySynonymExpander.DEFAULT_RESOURCE, expander.termCount());
        return expander;
    }

    /**
     * Start the MCP server.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Tool Search Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());

        final LatestProtocolStdioServerTransportProvider transportProvider =
                new LatestProtocolStdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(searchTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport handles communication on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Shutdown the MCP server.
     */
    public void shutdown() {
        logger.info("Shutting down MCP Tool Search Server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        logger.info("Served {} searches, tokenizer cache: {}", runtimeStats.getTotalSearches(), tokenizerStats);
        logger.info("MCP Tool Search Server shutdown complete");
    }

    ToolSearchTools getSearchTools() {
        return searchTools;
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = ApplicationConfig.isDeployedProfile();
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (stderr logging enabled)");
                logger.info("Catalog path: {}", config.getCatalogPath());
            }

            final ToolsearchApplication app = new ToolsearchApplication(config);
            app.init();
            app.start();

            logger.info("MCP Tool Search Server finished.");

        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start MCP Tool Search Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
