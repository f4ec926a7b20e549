package fr.lapetina.llm.verifier.domain.scoring;

import fr.lapetina.llm.verifier.domain.model.CapabilityCategory;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.domain.model.ProbeKind;
import fr.lapetina.llm.verifier.domain.model.ProbeResult;
import fr.lapetina.llm.verifier.domain.model.TaxonomyError;
import fr.lapetina.llm.verifier.domain.model.VerificationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ScoreCalculator calculator = new ScoreCalculator();

    @Test
    @DisplayName("should score 100 when every component is satisfied")
    void shouldScoreFullMarks() {
        List<ProbeResult> probes = List.of(
                passed(ProbeKind.EXISTENCE),
                responsiveness(Duration.ofMillis(50), Duration.ofMillis(300)),
                passed(ProbeKind.STREAMING),
                ProbeResult.builder(ProbeKind.FUNCTION_CALLING).passed(true).transportOptimized(true).build()
        );

        VerificationResult result = calculator.score("openai", "gpt-4o", probes, NOW);

        assertThat(result.score()).isEqualTo(100);
        assertThat(result.category()).isEqualTo(CapabilityCategory.FULLY_CAPABLE);
        assertThat(result.verifiedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("should score 0 and CHAT_ONLY when every probe failed")
    void shouldScoreZeroWhenAllFailed() {
        TaxonomyError error = TaxonomyError.transport("Connection refused");
        List<ProbeResult> probes = List.of(
                ProbeResult.failed(ProbeKind.EXISTENCE, error),
                ProbeResult.failed(ProbeKind.RESPONSIVENESS, error),
                ProbeResult.failed(ProbeKind.STREAMING, error)
        );

        VerificationResult result = calculator.score("openai", "gpt-4o", probes, NOW);

        assertThat(result.score()).isZero();
        assertThat(result.category()).isEqualTo(CapabilityCategory.CHAT_ONLY);
        assertThat(result.allFailed()).isTrue();
    }

    @Test
    @DisplayName("should be deterministic for the same probe results")
    void shouldBeDeterministic() {
        List<ProbeResult> probes = List.of(
                passed(ProbeKind.EXISTENCE),
                responsiveness(Duration.ofMillis(250), Duration.ofMillis(900)),
                passed(ProbeKind.VISION),
                ProbeResult.failed(ProbeKind.FUNCTION_CALLING, TaxonomyError.of(ErrorType.NOT_FOUND, 404, "no"))
        );

        assertThat(calculator.score(probes)).isEqualTo(calculator.score(probes));
    }

    @Nested
    @DisplayName("components")
    class Components {

        @Test
        @DisplayName("should weigh features by the share of attempted feature probes that passed")
        void shouldUseFeatureRatio() {
            List<ProbeResult> probes = List.of(
                    passed(ProbeKind.EXISTENCE),
                    responsiveness(Duration.ofMillis(300), Duration.ofMillis(1000)),
                    passed(ProbeKind.VISION),
                    ProbeResult.failed(ProbeKind.FUNCTION_CALLING, TaxonomyError.parse("no tool call"))
            );

            // 20 + 25 + 30 * 0.5 + 15 * (500 - 300) / 400
            assertThat(calculator.breakdown(probes).total()).isEqualTo(67.5);
            assertThat(calculator.score(probes)).isEqualTo(68);
        }

        @Test
        @DisplayName("should give no feature points when no feature was attempted")
        void shouldGiveNoFeaturePointsWithoutFeatureProbes() {
            List<ProbeResult> probes = List.of(
                    passed(ProbeKind.EXISTENCE),
                    responsiveness(Duration.ofMillis(100), Duration.ofMillis(400))
            );

            assertThat(calculator.breakdown(probes).features()).isZero();
            assertThat(calculator.score(probes)).isEqualTo(60);
        }

        @Test
        @DisplayName("should band latency on total latency when TTFT is absent")
        void shouldFallBackToTotalLatency() {
            List<ProbeResult> probes = List.of(
                    passed(ProbeKind.EXISTENCE),
                    ProbeResult.builder(ProbeKind.RESPONSIVENESS).passed(true).latency(Duration.ofMillis(500)).build()
            );

            assertThat(calculator.breakdown(probes).latency()).isZero();
            assertThat(calculator.score(probes)).isEqualTo(45);
        }

        @Test
        @DisplayName("should give no latency points when responsiveness failed")
        void shouldIgnoreLatencyOfFailedResponsiveness() {
            List<ProbeResult> probes = List.of(
                    passed(ProbeKind.EXISTENCE),
                    ProbeResult.builder(ProbeKind.RESPONSIVENESS)
                            .latency(Duration.ofMillis(20))
                            .timeToFirstToken(Duration.ofMillis(10))
                            .evidence("Total latency 70000ms exceeds 60000ms")
                            .build()
            );

            assertThat(calculator.score(probes)).isEqualTo(20);
        }

        @Test
        @DisplayName("should give no transport points for a compressed response that failed")
        void shouldIgnoreCompressionOfFailedProbes() {
            List<ProbeResult> probes = List.of(
                    passed(ProbeKind.EXISTENCE),
                    ProbeResult.builder(ProbeKind.RESPONSIVENESS)
                            .httpStatus(500)
                            .error(TaxonomyError.of(ErrorType.SERVER_ERROR, 500, "upstream failure"))
                            .transportOptimized(true)
                            .build()
            );

            assertThat(calculator.breakdown(probes).transportOptimization()).isZero();
            assertThat(calculator.score(probes)).isEqualTo(20);
        }

        @Test
        @DisplayName("should give transport points for a compressed response that passed")
        void shouldCountCompressionOfPassedProbes() {
            List<ProbeResult> probes = List.of(
                    passed(ProbeKind.EXISTENCE),
                    ProbeResult.builder(ProbeKind.STREAMING).passed(true).transportOptimized(true).build()
            );

            assertThat(calculator.breakdown(probes).transportOptimization()).isEqualTo(10.0);
        }
    }

    @Test
    @DisplayName("should reject weights that do not sum to 100")
    void shouldRejectUnbalancedWeights() {
        assertThatThrownBy(() -> new ScoringWeights(20, 25, 30, 15, 20,
                Duration.ofMillis(100), Duration.ofMillis(500)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum to 100");
    }

    private static ProbeResult passed(ProbeKind kind) {
        return ProbeResult.builder(kind).passed(true).latency(Duration.ofMillis(100)).build();
    }

    private static ProbeResult responsiveness(Duration ttft, Duration total) {
        return ProbeResult.builder(ProbeKind.RESPONSIVENESS)
                .passed(true)
                .timeToFirstToken(ttft)
                .latency(total)
                .build();
    }
}
