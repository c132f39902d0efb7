package de.mirkosertic.mcp.toolsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.toolsearch.catalog.CatalogValidationException;
import de.mirkosertic.mcp.toolsearch.catalog.ToolCatalogLoader;
import de.mirkosertic.mcp.toolsearch.catalog.ToolCatalogService;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ToolSearchTools")
class ToolSearchToolsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ToolCatalogService catalogService;
    private SearchRuntimeStats runtimeStats;
    private TokenizerCacheStats cacheStats;
    private ToolSearchTools tools;

    @BeforeEach
    void setUp() {
        catalogService = new ToolCatalogService(Path.of("unused-catalog.yaml"), new ToolCatalogLoader());
        catalogService.setEntries(List.of(
                CatalogEntry.of("fs", "read_file", "Read a file from disk"),
                CatalogEntry.of("fs", "write_file", "Write a file to disk"),
                CatalogEntry.of("net", "fetch_url", "Download a resource from a URL")));

        runtimeStats = new SearchRuntimeStats();
        cacheStats = new TokenizerCacheStats();
        final TextTokenizer tokenizer = new CachedTextTokenizer(new AnalyzerTextTokenizer(), 100, cacheStats);
        final HybridToolSearcher searcher = new HybridToolSearcher(tokenizer,
                DictionarySynonymExpander.fromGroups(List.of(List.of("download", "fetch", "get")), tokenizer));

        tools = new ToolSearchTools(catalogService, searcher, SearchOptions.defaults(), runtimeStats, cacheStats);
    }

    private JsonNode json(final McpSchema.CallToolResult result) throws IOException {
        return mapper.readTree(((McpSchema.TextContent) result.content().get(0)).text());
    }

    @Test
    @DisplayName("All tools are registered")
    void registration() {
        final List<McpServerFeatures.SyncToolSpecification> specifications = tools.getToolSpecifications();

        assertThat(specifications).extracting(spec -> spec.tool().name())
                .containsExactly("searchTools", "listTools", "reloadCatalog", "getSearchStats");
        assertThat(specifications.get(0).tool().inputSchema().required()).containsExactly("query");
    }

    @Nested
    @DisplayName("searchTools")
    class SearchTools {

        @Test
        @DisplayName("Returns ranked hits with relative relevance")
        void rankedHits() throws IOException {
            final McpSchema.CallToolResult result = tools.searchTools(Map.of("query", "read file"));

            assertThat(result.isError()).isFalse();
            final JsonNode node = json(result);
            assertThat(node.get("success").asBoolean()).isTrue();
            assertThat(node.get("totalTools").asInt()).isEqualTo(3);

            final JsonNode results = node.get("results");
            assertThat(results).hasSize(2);
            assertThat(results.get(0).get("name").asText()).isEqualTo("read_file");
            assertThat(results.get(0).get("server").asText()).isEqualTo("fs");
            assertThat(results.get(0).get("relevance").asDouble()).isEqualTo(1.0);
            assertThat(results.get(0).get("matchedTokens")).extracting(JsonNode::asText).containsExactly("read", "file");
            assertThat(results.get(1).get("name").asText()).isEqualTo("write_file");
            assertThat(results.get(1).get("relevance").asDouble())
                    .isCloseTo(0.697821982286245 / (1.375183282573142 + 0.6589741605919593), within(1e-9));
        }

        @Test
        @DisplayName("Relevance is relative to the highest score, not to the first hit")
        void relevanceUsesHighestScore() throws IOException {
            final List<SearchResult> ranked = new ToolRanker().rank(List.of(
                    new ScoredTool(CatalogEntry.of("s", "alpha", "Alpha"), 1.0008, List.of("alpha"), 0),
                    new ScoredTool(CatalogEntry.of("s", "beta", "Beta"), 1.0, List.of("beta"), 1)), 0.0, 10);
            final HybridToolSearcher searcher = mock(HybridToolSearcher.class);
            when(searcher.search(anyString(), anyList(), any(SearchOptions.class))).thenReturn(ranked);
            final ToolSearchTools mocked = new ToolSearchTools(catalogService, searcher,
                    SearchOptions.defaults(), runtimeStats, cacheStats);

            final JsonNode results = json(mocked.searchTools(Map.of("query", "alpha beta"))).get("results");

            assertThat(results).extracting(hit -> hit.get("name").asText()).containsExactly("beta", "alpha");
            assertThat(results.get(1).get("relevance").asDouble()).isEqualTo(1.0);
            assertThat(results.get(0).get("relevance").asDouble()).isCloseTo(1.0 / 1.0008, within(1e-12));
            assertThat(results).allSatisfy(hit -> assertThat(hit.get("relevance").asDouble()).isLessThanOrEqualTo(1.0));
        }

        @Test
        @DisplayName("Request parameters override the defaults")
        void parameters() throws IOException {
            final Map<String, Object> args = new HashMap<>();
            args.put("query", "download");
            args.put("useSynonyms", false);
            args.put("threshold", 0.0);
            args.put("limit", 1);

            final JsonNode results = json(tools.searchTools(args)).get("results");

            assertThat(results).hasSize(1);
            assertThat(results.get(0).get("name").asText()).isEqualTo("fetch_url");
            assertThat(results.get(0).get("matchedTokens")).extracting(JsonNode::asText).containsExactly("download");
        }

        @Test
        @DisplayName("Searches are recorded in the statistics")
        void recordsStatistics() {
            tools.searchTools(Map.of("query", "read file"));
            tools.searchTools(Map.of("query", "calendar"));

            assertThat(runtimeStats.getTotalSearches()).isEqualTo(2L);
            assertThat(runtimeStats.getEmptySearches()).isEqualTo(1L);
            assertThat(runtimeStats.getTotalResultCount()).isEqualTo(2L);
        }

        @Test
        @DisplayName("Invalid arguments produce an error result")
        void invalidArguments() throws IOException {
            final McpSchema.CallToolResult result = tools.searchTools(Map.of("query", "x", "limit", "many"));

            assertThat(result.isError()).isTrue();
            assertThat(json(result).get("error").asText()).startsWith("Invalid request: Argument 'limit'");
            assertThat(runtimeStats.getTotalSearches()).isZero();
        }

        @Test
        @DisplayName("Missing arguments search for nothing")
        void missingArguments() throws IOException {
            final JsonNode node = json(tools.searchTools(null));

            assertThat(node.get("success").asBoolean()).isTrue();
            assertThat(node.get("results")).isEmpty();
        }
    }

    @Nested
    @DisplayName("listTools")
    class ListTools {

        @Test
        @DisplayName("Lists the whole catalog")
        void all() throws IOException {
            final JsonNode node = json(tools.listTools(Map.of()));

            assertThat(node.get("totalTools").asInt()).isEqualTo(3);
            assertThat(node.get("servers")).extracting(JsonNode::asText).containsExactly("fs", "net");
            assertThat(node.get("tools").get(2).get("name").asText()).isEqualTo("fetch_url");
        }

        @Test
        @DisplayName("Filters by server")
        void byServer() throws IOException {
            final JsonNode node = json(tools.listTools(Map.of("server", "fs")));

            assertThat(node.get("totalTools").asInt()).isEqualTo(2);
            assertThat(node.get("servers")).extracting(JsonNode::asText).containsExactly("fs");
        }

        @Test
        @DisplayName("Unknown server is an error")
        void unknownServer() throws IOException {
            final McpSchema.CallToolResult result = tools.listTools(Map.of("server", "mail"));

            assertThat(result.isError()).isTrue();
            assertThat(json(result).get("error").asText()).isEqualTo("Unknown server: mail");
        }
    }

    @Nested
    @DisplayName("reloadCatalog")
    class ReloadCatalog {

        @Test
        @DisplayName("Reports tool and server count")
        void success() throws IOException {
            final ToolCatalogService service = mock(ToolCatalogService.class);
            when(service.reload()).thenReturn(4);
            when(service.getServers()).thenReturn(Set.of("a", "b"));
            when(service.getCatalogPath()).thenReturn(Path.of("catalog.yaml"));
            final ToolSearchTools mocked = new ToolSearchTools(service, mock(HybridToolSearcher.class),
                    SearchOptions.defaults(), runtimeStats, cacheStats);

            final JsonNode node = json(mocked.reloadCatalog());

            assertThat(node.get("success").asBoolean()).isTrue();
            assertThat(node.get("toolCount").asInt()).isEqualTo(4);
            assertThat(node.get("serverCount").asInt()).isEqualTo(2);
            assertThat(node.get("catalogPath").asText()).isEqualTo("catalog.yaml");
        }

        @Test
        @DisplayName("Validation failures are reported")
        void validationFailure() throws IOException {
            final ToolCatalogService service = mock(ToolCatalogService.class);
            when(service.reload()).thenThrow(new CatalogValidationException("servers.fs.tools[0].name", "must be a non-blank string"));
            final ToolSearchTools mocked = new ToolSearchTools(service, mock(HybridToolSearcher.class),
                    SearchOptions.defaults(), runtimeStats, cacheStats);

            final McpSchema.CallToolResult result = mocked.reloadCatalog();

            assertThat(result.isError()).isTrue();
            assertThat(json(result).get("error").asText())
                    .isEqualTo("Invalid catalog: servers.fs.tools[0].name must be a non-blank string");
        }

        @Test
        @DisplayName("Missing catalog file is reported")
        void missingFile() throws IOException {
            final McpSchema.CallToolResult result = tools.reloadCatalog();

            assertThat(result.isError()).isTrue();
            assertThat(json(result).get("error").asText()).startsWith("Error reloading catalog: Catalog file does not exist");
            assertThat(catalogService.getEntries()).hasSize(3);
        }
    }

    @Test
    @DisplayName("getSearchStats reports searches, cache and catalog")
    void searchStats() throws IOException {
        tools.searchTools(Map.of("query", "read file"));
        tools.searchTools(Map.of("query", "read file"));

        final JsonNode node = json(tools.getSearchStats());

        assertThat(node.get("success").asBoolean()).isTrue();
        assertThat(node.get("totalSearches").asLong()).isEqualTo(2L);
        assertThat(node.get("catalogTools").asInt()).isEqualTo(3);
        assertThat(node.get("tokenizerCacheHitRate").asDouble()).isGreaterThan(0.0);
        assertThat(node.get("durationPercentiles").has("p50")).isTrue();
        assertThat(node.get("version").asText()).isNotBlank();
    }

    @Test
    @DisplayName("getSearchStats before any search omits duration details")
    void searchStatsInitial() throws IOException {
        final JsonNode node = json(tools.getSearchStats());

        assertThat(node.get("totalSearches").asLong()).isZero();
        assertThat(node.has("minDurationMicros")).isFalse();
        assertThat(node.has("durationPercentiles")).isFalse();
    }
}
