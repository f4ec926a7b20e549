package fr.lapetina.llm.verifier;

import fr.lapetina.llm.verifier.domain.event.EventType;
import fr.lapetina.llm.verifier.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.verifier.infrastructure.config.VerifierConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerifierFactoryTest {

    @Test
    @DisplayName("should accept wire names and enum names for event types")
    void shouldParseEventTypes() {
        assertThat(VerifierFactory.parseEventTypes(List.of("score.changed", "VERIFICATION_FAILED", "verification_started")))
                .containsExactlyInAnyOrder(EventType.SCORE_CHANGED, EventType.VERIFICATION_FAILED,
                        EventType.VERIFICATION_STARTED);
        assertThat(VerifierFactory.parseEventTypes(List.of())).isEmpty();
        assertThat(VerifierFactory.parseEventTypes(null)).isEmpty();
    }

    @Test
    @DisplayName("should reject unknown event types")
    void shouldRejectUnknownEventType() {
        assertThatThrownBy(() -> VerifierFactory.parseEventTypes(List.of("model.deleted")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("model.deleted");
    }

    @Test
    @DisplayName("should skip disabled providers and their models, and omit disabled components")
    void shouldHonourDisabledSections() {
        VerifierConfig config = new ConfigLoader("test-config.yaml").load();
        config.getProviders().get(0).setEnabled(false);
        config.getNotifications().setEnabled(false);
        config.getMetrics().setEnabled(false);

        try (VerifierFactory factory = VerifierFactory.create(config).start()) {
            assertThat(factory.getProviderRegistry().size()).isZero();
            assertThat(factory.getProviderRegistry().getAllModels()).isEmpty();
            assertThat(factory.getDispatcher()).isNull();
            assertThat(factory.getMetricsRegistry()).isNull();
            assertThat(factory.getVerificationCache().hasDistributedTier()).isFalse();
        }
    }
}
