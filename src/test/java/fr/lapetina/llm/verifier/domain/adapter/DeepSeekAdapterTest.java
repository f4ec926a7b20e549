package fr.lapetina.llm.verifier.domain.adapter;

import fr.lapetina.llm.verifier.domain.model.ChatRequest;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.domain.model.RateLimitInfo;
import fr.lapetina.llm.verifier.domain.model.StreamingChunk;
import fr.lapetina.llm.verifier.domain.model.TaxonomyError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeepSeekAdapterTest {

    private final DeepSeekAdapter adapter = new DeepSeekAdapter();

    @Test
    @DisplayName("should pick temperature from prompt keywords")
    void shouldPickTemperatureFromPrompt() {
        assertThat(adapter.optimize(ChatRequest.ofPrompt("Write a poem")).temperature())
                .isEqualTo(DeepSeekAdapter.CREATIVE_TEMPERATURE);
        assertThat(adapter.optimize(ChatRequest.ofPrompt("Review this code")).temperature())
                .isEqualTo(DeepSeekAdapter.CODE_TEMPERATURE);
        assertThat(adapter.optimize(ChatRequest.ofPrompt("Hello")).temperature()).isNull();
    }

    @Test
    @DisplayName("should not inject a system instruction")
    void shouldNotInjectSystemMessage() {
        ChatRequest optimized = adapter.optimize(ChatRequest.ofPrompt("Hello"));

        assertThat(optimized.hasSystemMessage()).isFalse();
        assertThat(optimized.maxTokens()).isEqualTo(DeepSeekAdapter.DEFAULT_MAX_TOKENS);
    }

    @Test
    @DisplayName("should count reasoning content and end only on [DONE]")
    void shouldStreamReasoningContent() {
        String body = "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"thinking\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\"answer\"},\"finish_reason\":\"stop\"}]}\n\n"
                + "data: [DONE]\n\n";

        try (ChunkStream stream = adapter.parseStream(
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)))) {
            List<StreamingChunk> chunks = stream.stream().toList();

            assertThat(chunks).extracting(StreamingChunk::content).containsExactly("thinking", "answer", "");
            assertThat(chunks.get(1).finish()).isFalse();
            assertThat(chunks.get(2).finish()).isTrue();
        }
    }

    @Test
    @DisplayName("should tag insufficient balance errors")
    void shouldTagInsufficientBalance() {
        TaxonomyError error = adapter.classifyError(402, "Payment required");

        assertThat(error.type()).isEqualTo(ErrorType.UNCLASSIFIED);
        assertThat(error.providerType()).isEqualTo("insufficient_balance");
        assertThat(error.httpStatus()).isEqualTo(402);
    }

    @Test
    @DisplayName("should classify auth, rate-limit and server errors like every provider")
    void shouldClassifyStandardStatuses() {
        TaxonomyError unauthorized = adapter.classifyError(401,
                "{\"error\":{\"message\":\"Authentication Fails\",\"type\":\"authentication_error\"}}");
        TaxonomyError rateLimited = adapter.classifyError(429, "Too Many Requests");

        assertThat(unauthorized.type()).isEqualTo(ErrorType.UNAUTHORIZED);
        assertThat(unauthorized.message()).isEqualTo("Authentication Fails");
        assertThat(unauthorized.providerType()).isEqualTo("authentication_error");
        assertThat(rateLimited.type()).isEqualTo(ErrorType.RATE_LIMITED);
        assertThat(rateLimited.httpStatus()).isEqualTo(429);
        assertThat(adapter.classifyError(503, null).type()).isEqualTo(ErrorType.SERVER_ERROR);
    }

    @Test
    @DisplayName("should read its own rate-limit headers without a reset time")
    void shouldReadRateLimitHeaders() {
        HttpHeaders headers = HttpHeaders.of(Map.of(
                "x-rpm-limit", List.of("60"),
                "x-tpm-limit", List.of("100000")
        ), (name, value) -> true);

        RateLimitInfo info = adapter.rateLimitInfo(headers);

        assertThat(info.requestsPerMinute()).isEqualTo(60);
        assertThat(info.tokensPerMinute()).isEqualTo(100000);
        assertThat(info.resetTime()).isNull();
        assertThat(adapter.optimalBatchSize()).isEqualTo(10);
    }
}
