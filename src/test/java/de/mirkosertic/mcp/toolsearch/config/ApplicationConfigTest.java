package de.mirkosertic.mcp.toolsearch.config;

import de.mirkosertic.mcp.toolsearch.SearchOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig")
class ApplicationConfigTest {

    private static Map<String, Object> yaml(final String text) {
        return new Yaml().load(text);
    }

    @Nested
    @DisplayName("YAML settings")
    class YamlSettings {

        @Test
        @DisplayName("All keys are applied")
        void allKeys() {
            final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                    toolsearch:
                      catalog:
                        path: /etc/tools/catalog.yaml
                      synonyms:
                        path: /etc/tools/synonyms.yaml
                      search:
                        threshold: 0.5
                        limit: 25
                        use-synonyms: false
                      tokenizer:
                        cache-size: 500
                    """));

            assertThat(config.getCatalogPath()).isEqualTo(Path.of("/etc/tools/catalog.yaml"));
            assertThat(config.getSynonymsPath()).isEqualTo(Path.of("/etc/tools/synonyms.yaml"));
            assertThat(config.getThreshold()).isEqualTo(0.5);
            assertThat(config.getLimit()).isEqualTo(25);
            assertThat(config.isUseSynonyms()).isFalse();
            assertThat(config.getTokenizerCacheSize()).isEqualTo(500L);
            assertThat(config.getDefaultSearchOptions()).isEqualTo(new SearchOptions(0.5, 25, false));
        }

        @Test
        @DisplayName("Missing keys keep the defaults")
        void defaults() {
            final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("other: 1"));

            assertThat(config.getDefaultSearchOptions()).isEqualTo(SearchOptions.defaults());
            assertThat(config.getSynonymsPath()).isNull();
            assertThat(config.getTokenizerCacheSize()).isEqualTo(10_000L);
            assertThat(config.getCatalogPath())
                    .isEqualTo(ApplicationConfig.getConfigDirectory().resolve("catalog.yaml"));
        }

        @Test
        @DisplayName("Blank synonyms path selects the bundled dictionary")
        void blankSynonymsPath() {
            final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                    toolsearch:
                      synonyms:
                        path: ""
                    """));

            assertThat(config.getSynonymsPath()).isNull();
        }

        @Test
        @DisplayName("Integer threshold is accepted")
        void integerThreshold() {
            final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                    toolsearch:
                      search:
                        threshold: 1
                    """));

            assertThat(config.getThreshold()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Variable resolution")
    class VariableResolution {

        @AfterEach
        void clearProperties() {
            System.clearProperty("toolsearch.test.dir");
        }

        @Test
        @DisplayName("Plain values are returned unchanged")
        void plain() {
            assertThat(ApplicationConfig.resolveVariables("/tmp/catalog.yaml")).isEqualTo("/tmp/catalog.yaml");
            assertThat(ApplicationConfig.resolveVariables(null)).isNull();
        }

        @Test
        @DisplayName("System properties are substituted")
        void systemProperty() {
            System.setProperty("toolsearch.test.dir", "/data");

            assertThat(ApplicationConfig.resolveVariables("${toolsearch.test.dir}/catalog.yaml"))
                    .isEqualTo("/data/catalog.yaml");
        }

        @Test
        @DisplayName("Defaults apply to unknown variables")
        void defaultValue() {
            assertThat(ApplicationConfig.resolveVariables("${TOOLSEARCH_SURELY_UNSET_VARIABLE:/fallback}/x"))
                    .isEqualTo("/fallback/x");
            assertThat(ApplicationConfig.resolveVariables("a${TOOLSEARCH_SURELY_UNSET_VARIABLE}b"))
                    .isEqualTo("ab");
        }

        @Test
        @DisplayName("Unterminated placeholders are left alone")
        void unterminated() {
            assertThat(ApplicationConfig.resolveVariables("${broken")).isEqualTo("${broken");
        }

        @Test
        @DisplayName("YAML values are resolved")
        void resolvedInYaml() {
            System.setProperty("toolsearch.test.dir", "/srv/tools");

            final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                    toolsearch:
                      catalog:
                        path: ${toolsearch.test.dir}/catalog.yaml
                    """));

            assertThat(config.getCatalogPath()).isEqualTo(Path.of("/srv/tools/catalog.yaml"));
        }
    }

    @Test
    @DisplayName("Configuration directory lives in the user home")
    void configDirectory() {
        assertThat(ApplicationConfig.getConfigDirectory())
                .isEqualTo(Path.of(System.getProperty("user.home"), ".mcptoolsearch"));
        assertThat(ApplicationConfig.getUserConfigPath().getFileName().toString()).isEqualTo("config.yaml");
    }
}
