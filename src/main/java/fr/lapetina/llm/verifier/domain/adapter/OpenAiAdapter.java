package fr.lapetina.llm.verifier.domain.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.domain.model.ChatRequest;
import fr.lapetina.llm.verifier.domain.model.RateLimitInfo;
import fr.lapetina.llm.verifier.domain.model.TaxonomyError;

import java.io.InputStream;
import java.net.http.HttpHeaders;
import java.time.Clock;
import java.util.Locale;

/**
 * Adapter for the OpenAI chat-completions API.
 *
 * <ul>
 *   <li>Code prompts without an explicit temperature get {@value #CODE_TEMPERATURE}</li>
 *   <li>Missing max tokens default to {@value #DEFAULT_MAX_TOKENS}</li>
 *   <li>A default system instruction is prepended when none is present</li>
 *   <li>A non-empty {@code finish_reason} ends the stream like {@code [DONE]}</li>
 * </ul>
 */
public final class OpenAiAdapter implements ProviderAdapter {

    public static final String NAME = "openai";

    static final double CODE_TEMPERATURE = 0.1;
    static final int DEFAULT_MAX_TOKENS = 2048;
    static final String DEFAULT_SYSTEM_INSTRUCTION =
            "You are a helpful AI assistant. Provide accurate and well-structured responses.";

    private static final int BATCH_SIZE = 20;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OpenAiAdapter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public OpenAiAdapter() {
        this(AdapterSupport.newObjectMapper(), Clock.systemUTC());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ChatRequest optimize(ChatRequest request) {
        ChatRequest optimized = request;

        if (optimized.temperature() == null
                && optimized.prompt().toLowerCase(Locale.ROOT).contains("code")) {
            optimized = optimized.withTemperature(CODE_TEMPERATURE);
        }
        if (optimized.maxTokens() == null) {
            optimized = optimized.withMaxTokens(DEFAULT_MAX_TOKENS);
        }
        if (!optimized.hasSystemMessage()) {
            optimized = optimized.withSystemMessage(DEFAULT_SYSTEM_INSTRUCTION);
        }
        return optimized;
    }

    @Override
    public ChunkStream parseStream(InputStream body) {
        return new ChunkStream(body, OpenAiAdapter::decodeEvent, objectMapper);
    }

    private static EventDecoder.Decoded decodeEvent(JsonNode event) {
        JsonNode error = event.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = AdapterSupport.text(error.path("message"));
            return EventDecoder.Decoded.error(message.isEmpty() ? error.toString() : message);
        }
        JsonNode choice = event.path("choices").path(0);
        String content = AdapterSupport.text(choice.path("delta").path("content"));
        boolean finished = !AdapterSupport.text(choice.path("finish_reason")).isEmpty();
        return EventDecoder.Decoded.of(content, finished);
    }

    @Override
    public TaxonomyError classifyError(int statusCode, String body) {
        return AdapterSupport.classifyStandard(objectMapper, statusCode, body);
    }

    @Override
    public int optimalBatchSize() {
        return BATCH_SIZE;
    }

    @Override
    public RateLimitInfo rateLimitInfo(HttpHeaders headers) {
        return new RateLimitInfo(
                AdapterSupport.intHeader(headers, "x-ratelimit-limit-requests"),
                AdapterSupport.intHeader(headers, "x-ratelimit-limit-tokens"),
                AdapterSupport.resetHeader(headers, "x-ratelimit-reset-requests", clock.instant())
        );
    }
}
