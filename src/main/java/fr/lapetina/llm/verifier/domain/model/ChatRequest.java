package fr.lapetina.llm.verifier.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Canonical chat request shape sent to providers.
 * Immutable; adapters derive tuned copies through the {@code with*} methods.
 *
 * <p>{@code maxTokens} and {@code temperature} are null when the caller did not set them,
 * which is what lets adapters tell an explicit value from a missing one.
 */
public record ChatRequest(
        List<Message> messages,
        Integer maxTokens,
        Double temperature,
        boolean stream,
        List<Map<String, Object>> tools,
        Map<String, Object> extra
) {
    public ChatRequest {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        messages = List.copyOf(messages);
        tools = tools != null ? List.copyOf(tools) : List.of();
        extra = extra != null ? Map.copyOf(extra) : Map.of();
    }

    /**
     * Chat message. {@code content} is a string for plain text, or a list of
     * content parts for multimodal messages.
     */
    public record Message(String role, Object content) {
        public Message {
            Objects.requireNonNull(role, "Role is required");
            Objects.requireNonNull(content, "Content is required");
        }

        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(Object content) {
            return new Message("user", content);
        }

        /**
         * Text of the message; multimodal parts contribute their {@code text} entries.
         */
        public String text() {
            if (content instanceof String s) {
                return s;
            }
            if (content instanceof List<?> parts) {
                return parts.stream()
                        .filter(Map.class::isInstance)
                        .map(part -> ((Map<?, ?>) part).get("text"))
                        .filter(Objects::nonNull)
                        .map(Object::toString)
                        .collect(Collectors.joining(" "));
            }
            return content.toString();
        }
    }

    public static ChatRequest ofPrompt(String prompt) {
        return builder().addMessage(Message.user(prompt)).build();
    }

    /**
     * Concatenated text of all user messages, used for prompt heuristics.
     */
    public String prompt() {
        return messages.stream()
                .filter(m -> "user".equals(m.role()))
                .map(Message::text)
                .collect(Collectors.joining("\n"));
    }

    public boolean hasSystemMessage() {
        return "system".equals(messages.get(0).role());
    }

    public ChatRequest withTemperature(Double temperature) {
        return new ChatRequest(messages, maxTokens, temperature, stream, tools, extra);
    }

    public ChatRequest withMaxTokens(Integer maxTokens) {
        return new ChatRequest(messages, maxTokens, temperature, stream, tools, extra);
    }

    public ChatRequest withMessages(List<Message> messages) {
        return new ChatRequest(messages, maxTokens, temperature, stream, tools, extra);
    }

    public ChatRequest withStream(boolean stream) {
        return new ChatRequest(messages, maxTokens, temperature, stream, tools, extra);
    }

    public ChatRequest withSystemMessage(String instruction) {
        List<Message> withSystem = new ArrayList<>(messages.size() + 1);
        withSystem.add(Message.system(instruction));
        withSystem.addAll(messages);
        return withMessages(withSystem);
    }

    /**
     * Wire body for a chat-completions endpoint.
     * Extra user fields are kept; the canonical fields are written last.
     */
    public Map<String, Object> toBody(String model) {
        Map<String, Object> body = new LinkedHashMap<>(extra);
        body.put("model", model);
        body.put("messages", messages.stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList());
        if (maxTokens != null) {
            body.put("max_tokens", maxTokens);
        }
        if (temperature != null) {
            body.put("temperature", temperature);
        }
        body.put("stream", stream);
        if (!tools.isEmpty()) {
            body.put("tools", tools);
        }
        return body;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Message> messages = new ArrayList<>();
        private Integer maxTokens;
        private Double temperature;
        private boolean stream;
        private List<Map<String, Object>> tools;
        private Map<String, Object> extra;

        public Builder addMessage(Message message) {
            this.messages.add(message);
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages.clear();
            this.messages.addAll(messages);
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder tools(List<Map<String, Object>> tools) {
            this.tools = tools;
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            this.extra = extra;
            return this;
        }

        public ChatRequest build() {
            return new ChatRequest(messages, maxTokens, temperature, stream, tools, extra);
        }
    }
}
