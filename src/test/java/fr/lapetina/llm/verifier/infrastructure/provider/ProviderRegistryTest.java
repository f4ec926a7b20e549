package fr.lapetina.llm.verifier.infrastructure.provider;

import fr.lapetina.llm.verifier.domain.model.Model;
import fr.lapetina.llm.verifier.domain.model.Provider;
import fr.lapetina.llm.verifier.infrastructure.provider.ProviderRegistry.ProviderRegistryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRegistryTest {

    private ProviderRegistry registry;
    private List<ProviderRegistryEvent> events;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
        events = new ArrayList<>();
        registry.addListener(events::add);
    }

    @Test
    @DisplayName("should look providers up case-insensitively")
    void shouldLookUpCaseInsensitively() {
        registry.registerProvider(Provider.of("OpenAI", "https://api.openai.com/v1", "env:OPENAI_API_KEY"));

        assertThat(registry.getProvider("openai")).isPresent();
        assertThat(registry.getProvider("OPENAI").map(Provider::name)).contains("OpenAI");
        assertThat(registry.getProvider(null)).isEmpty();
    }

    @Test
    @DisplayName("should keep models when a provider is replaced")
    void shouldKeepModelsOnReplace() {
        registry.registerProvider(Provider.of("openai", "https://api.openai.com/v1", "k1"));
        registry.registerModel(Model.of("openai", "gpt-4o"));

        registry.registerProvider(Provider.of("openai", "https://proxy.example.com/v1", "k2"));

        assertThat(registry.getProvider("openai").map(p -> p.baseUrl().getHost())).contains("proxy.example.com");
        assertThat(registry.getModels("openai")).extracting(Model::id).containsExactly("gpt-4o");
        assertThat(events).extracting(ProviderRegistryEvent::type).containsExactly(
                ProviderRegistryEvent.Type.ADDED,
                ProviderRegistryEvent.Type.MODEL_ADDED,
                ProviderRegistryEvent.Type.UPDATED);
    }

    @Test
    @DisplayName("should reject models of unregistered providers")
    void shouldRejectOrphanModel() {
        assertThatThrownBy(() -> registry.registerModel(Model.of("mistral", "large")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown provider: mistral");
    }

    @Test
    @DisplayName("should drop a provider's models when it is removed")
    void shouldRemoveModelsWithProvider() {
        registry.registerProvider(Provider.of("deepseek", "https://api.deepseek.com/v1", "k"));
        registry.registerModel(Model.of("deepseek", "deepseek-chat"));

        assertThat(registry.removeProvider("DeepSeek")).isPresent();

        assertThat(registry.getModel("deepseek", "deepseek-chat")).isEmpty();
        assertThat(registry.getAllModels()).isEmpty();
        assertThat(registry.size()).isZero();
        assertThat(registry.removeProvider("deepseek")).isEmpty();
    }

    @Test
    @DisplayName("should keep notifying when a listener fails")
    void shouldIsolateFailingListener() {
        registry.addListener(e -> {
            throw new IllegalStateException("boom");
        });

        registry.registerProvider(Provider.of("openai", "https://api.openai.com/v1", "k"));

        assertThat(events).hasSize(1);
    }
}
