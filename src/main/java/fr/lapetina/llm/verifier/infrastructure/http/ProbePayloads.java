package fr.lapetina.llm.verifier.infrastructure.http;

import fr.lapetina.llm.verifier.domain.model.ChatRequest;
import fr.lapetina.llm.verifier.domain.model.ProbeKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical probe exchanges. Every provider receives the same prompts so
 * results stay comparable; adapters only tune the defaults around them.
 */
public final class ProbePayloads {

    public static final String RESPONSIVENESS_PROMPT = "Hello, please respond with just the word 'pong'.";
    public static final String STREAMING_PROMPT = "Say 'hello' in 10 words.";
    public static final String FUNCTION_CALLING_PROMPT = "What is the weather like in New York?";
    public static final String VISION_PROMPT = "Describe this image in one short sentence.";
    public static final String EMBEDDINGS_INPUT = "Hello world";
    public static final String WEATHER_FUNCTION = "get_current_weather";

    // 1x1 transparent PNG
    static final String TINY_PNG_DATA_URL = "data:image/png;base64,"
            + "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAYAAAAfFcSJAAAADUlEQVR42mNk+M9QDwADhgGAWjR9awAAAABJRU5ErkJggg==";

    private ProbePayloads() {
    }

    /**
     * Default chat payload for a probe kind, or null for kinds that send no chat body.
     */
    public static ChatRequest forKind(ProbeKind kind) {
        return switch (kind) {
            case EXISTENCE, EMBEDDINGS -> null;
            case RESPONSIVENESS -> ChatRequest.builder()
                    .addMessage(ChatRequest.Message.user(RESPONSIVENESS_PROMPT))
                    .maxTokens(10)
                    .stream(true)
                    .build();
            case STREAMING -> ChatRequest.builder()
                    .addMessage(ChatRequest.Message.user(STREAMING_PROMPT))
                    .maxTokens(50)
                    .stream(true)
                    .build();
            case FUNCTION_CALLING -> ChatRequest.builder()
                    .addMessage(ChatRequest.Message.user(FUNCTION_CALLING_PROMPT))
                    .tools(List.of(weatherTool()))
                    .extra(Map.of("tool_choice", "auto"))
                    .build();
            case VISION -> ChatRequest.builder()
                    .addMessage(ChatRequest.Message.user(List.of(
                            Map.of("type", "text", "text", VISION_PROMPT),
                            Map.of("type", "image_url", "image_url", Map.of("url", TINY_PNG_DATA_URL)))))
                    .maxTokens(50)
                    .build();
        };
    }

    public static Map<String, Object> embeddingsBody(String model) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", EMBEDDINGS_INPUT);
        return body;
    }

    static Map<String, Object> weatherTool() {
        Map<String, Object> location = Map.of(
                "type", "string",
                "description", "The city and state, e.g. San Francisco, CA");
        Map<String, Object> unit = Map.of(
                "type", "string",
                "enum", List.of("celsius", "fahrenheit"));
        Map<String, Object> parameters = Map.of(
                "type", "object",
                "properties", Map.of("location", location, "unit", unit),
                "required", List.of("location"));
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", WEATHER_FUNCTION,
                        "description", "Get the current weather in a given location",
                        "parameters", parameters));
    }
}
