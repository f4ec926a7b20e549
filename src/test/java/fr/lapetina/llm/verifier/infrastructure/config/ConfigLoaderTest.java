package fr.lapetina.llm.verifier.infrastructure.config;

import fr.lapetina.llm.verifier.domain.model.ModelFeature;
import fr.lapetina.llm.verifier.domain.scoring.ScoringWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("loading")
    class Loading {

        @Test
        @DisplayName("should load the test configuration from the classpath")
        void shouldLoadFromClasspath() {
            VerifierConfig config = new ConfigLoader("test-config.yaml").load();

            assertThat(config.getProviders()).hasSize(1);
            VerifierConfig.ProviderConfig provider = config.getProviders().get(0);
            assertThat(provider.getName()).isEqualTo("fake");
            assertThat(provider.getAdapter()).isEqualTo("openai");
            assertThat(config.getModels().get(0).featureSet())
                    .containsExactlyInAnyOrder(ModelFeature.STREAMING, ModelFeature.FUNCTION_CALLING);
            assertThat(config.getNotifications().getQueue().getCapacity()).isEqualTo(16);
            assertThat(config.getScheduler().getIntervalMs()).isZero();
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_verifier");
        }

        @Test
        @DisplayName("should prefer a file on disk")
        void shouldLoadFromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("verifier.yaml");
            Files.writeString(file, """
                    providers:
                      - name: local
                        baseUrl: http://localhost:8080/v1
                    """);

            VerifierConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getProviders()).extracting(VerifierConfig.ProviderConfig::getName)
                    .containsExactly("local");
        }

        @Test
        @DisplayName("should apply defaults to an empty document")
        void shouldApplyDefaults() {
            VerifierConfig config = new ConfigLoader("unused").loadFromStream(yaml(""));

            assertThat(config.getProviders()).isEmpty();
            assertThat(config.getCache().isEnabled()).isTrue();
            assertThat(config.getCache().getRedis().isEnabled()).isFalse();
            assertThat(config.getScoring().toWeights()).isEqualTo(ScoringWeights.DEFAULT);
        }

        @Test
        @DisplayName("should fail on a missing file")
        void shouldFailOnMissingFile() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml() {
            assertThatThrownBy(() -> new ConfigLoader("unused").loadFromStream(yaml("providers: [unclosed")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Invalid YAML");
        }

        @Test
        @DisplayName("should reject a model of an unknown provider")
        void shouldRejectOrphanModel() {
            String content = """
                    providers:
                      - name: openai
                        baseUrl: https://api.openai.com/v1
                    models:
                      - provider: mistral
                        id: mistral-large
                    """;

            assertThatThrownBy(() -> new ConfigLoader("unused").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("unknown provider: mistral");
        }

        @Test
        @DisplayName("should reject duplicate providers regardless of case")
        void shouldRejectDuplicateProviders() {
            String content = """
                    providers:
                      - name: openai
                        baseUrl: https://api.openai.com/v1
                      - name: OpenAI
                        baseUrl: https://proxy.example.com/v1
                    """;

            assertThatThrownBy(() -> new ConfigLoader("unused").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Duplicate provider");
        }

        @Test
        @DisplayName("should reject unknown features and non-http base URLs")
        void shouldRejectBadValues() {
            String badFeature = """
                    providers:
                      - name: openai
                        baseUrl: https://api.openai.com/v1
                    models:
                      - provider: openai
                        id: gpt-4o
                        features: [telepathy]
                    """;
            String badUrl = """
                    providers:
                      - name: openai
                        baseUrl: ftp://api.openai.com
                    """;

            assertThatThrownBy(() -> new ConfigLoader("unused").loadFromStream(yaml(badFeature)))
                    .hasMessageContaining("Unknown model feature: telepathy");
            assertThatThrownBy(() -> new ConfigLoader("unused").loadFromStream(yaml(badUrl)))
                    .hasMessageContaining("must be http(s)");
        }

        @Test
        @DisplayName("should reject scoring weights that do not sum to 100")
        void shouldRejectUnbalancedWeights() {
            String content = """
                    scoring:
                      existenceWeight: 50
                    """;

            assertThatThrownBy(() -> new ConfigLoader("unused").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Weights must sum to 100");
        }
    }
}
