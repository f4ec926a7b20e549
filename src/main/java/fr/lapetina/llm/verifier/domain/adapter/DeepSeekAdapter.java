package fr.lapetina.llm.verifier.domain.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.domain.model.ChatRequest;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.domain.model.RateLimitInfo;
import fr.lapetina.llm.verifier.domain.model.TaxonomyError;

import java.io.InputStream;
import java.net.http.HttpHeaders;
import java.util.Locale;

/**
 * Adapter for the DeepSeek API.
 *
 * <p>More conservative than OpenAI: a smaller batch size and no injected system instruction.
 * Reasoning models stream {@code reasoning_content} before the answer; it counts as content
 * so time-to-first-token reflects when the model actually started producing output.
 * Only {@code [DONE]} ends the stream.
 */
public final class DeepSeekAdapter implements ProviderAdapter {

    public static final String NAME = "deepseek";

    static final double CREATIVE_TEMPERATURE = 0.8;
    static final double CODE_TEMPERATURE = 0.2;
    static final int DEFAULT_MAX_TOKENS = 4096;

    private static final int BATCH_SIZE = 10;
    private static final int INSUFFICIENT_BALANCE = 402;

    private final ObjectMapper objectMapper;

    public DeepSeekAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DeepSeekAdapter() {
        this(AdapterSupport.newObjectMapper());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ChatRequest optimize(ChatRequest request) {
        ChatRequest optimized = request;

        if (optimized.temperature() == null) {
            String prompt = optimized.prompt().toLowerCase(Locale.ROOT);
            if (prompt.contains("creative") || prompt.contains("write")) {
                optimized = optimized.withTemperature(CREATIVE_TEMPERATURE);
            } else if (prompt.contains("code")) {
                optimized = optimized.withTemperature(CODE_TEMPERATURE);
            }
        }
        if (optimized.maxTokens() == null) {
            optimized = optimized.withMaxTokens(DEFAULT_MAX_TOKENS);
        }
        return optimized;
    }

    @Override
    public ChunkStream parseStream(InputStream body) {
        return new ChunkStream(body, DeepSeekAdapter::decodeEvent, objectMapper);
    }

    private static EventDecoder.Decoded decodeEvent(JsonNode event) {
        if (event.hasNonNull("error")) {
            JsonNode error = event.get("error");
            String message = AdapterSupport.text(error.path("message"));
            return EventDecoder.Decoded.error(message.isEmpty() ? error.toString() : message);
        }
        JsonNode delta = event.path("choices").path(0).path("delta");
        String content = AdapterSupport.text(delta.path("content"));
        if (content.isEmpty()) {
            content = AdapterSupport.text(delta.path("reasoning_content"));
        }
        return EventDecoder.Decoded.of(content, false);
    }

    @Override
    public TaxonomyError classifyError(int statusCode, String body) {
        TaxonomyError standard = AdapterSupport.classifyStandard(objectMapper, statusCode, body);
        if (statusCode == INSUFFICIENT_BALANCE && standard.providerType() == null) {
            return new TaxonomyError(ErrorType.UNCLASSIFIED, statusCode,
                    standard.message(), "insufficient_balance");
        }
        return standard;
    }

    @Override
    public int optimalBatchSize() {
        return BATCH_SIZE;
    }

    @Override
    public RateLimitInfo rateLimitInfo(HttpHeaders headers) {
        return new RateLimitInfo(
                AdapterSupport.intHeader(headers, "x-rpm-limit"),
                AdapterSupport.intHeader(headers, "x-tpm-limit"),
                null
        );
    }
}
