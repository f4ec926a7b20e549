package fr.lapetina.llm.verifier.domain.adapter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.domain.model.TaxonomyError;

import java.net.http.HttpHeaders;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers shared by adapters of OpenAI-compatible providers.
 * Adapters compose these rather than extend a common base.
 */
public final class AdapterSupport {

    private static final int MAX_RAW_BODY = 256;
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|h|m|s)");
    // Anything this large is an epoch timestamp rather than a relative delay
    private static final long EPOCH_SECONDS_FLOOR = 1_000_000_000L;

    private AdapterSupport() {
    }

    /**
     * Creates the JSON mapper configuration used throughout the engine.
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Standard status mapping. 401, 429, 5xx and 404 are fixed regardless of the body;
     * anything else carries the provider's own error details when the body parses.
     */
    public static TaxonomyError classifyStandard(ObjectMapper objectMapper, int statusCode, String body) {
        Optional<ProviderError> providerError = parseProviderError(objectMapper, body);
        String providerMessage = providerError.map(ProviderError::message).orElse(null);
        String providerType = providerError.map(ProviderError::type).orElse(null);

        if (statusCode == 401) {
            return new TaxonomyError(ErrorType.UNAUTHORIZED, statusCode,
                    orDefault(providerMessage, "Unauthorized"), providerType);
        }
        if (statusCode == 429) {
            return new TaxonomyError(ErrorType.RATE_LIMITED, statusCode,
                    orDefault(providerMessage, "Rate limited"), providerType);
        }
        if (statusCode >= 500 && statusCode < 600) {
            return new TaxonomyError(ErrorType.SERVER_ERROR, statusCode,
                    orDefault(providerMessage, "Server error"), providerType);
        }
        if (statusCode == 404) {
            return new TaxonomyError(ErrorType.NOT_FOUND, statusCode,
                    orDefault(providerMessage, "Not found"), providerType);
        }
        if (providerError.isPresent()) {
            return new TaxonomyError(ErrorType.UNCLASSIFIED, statusCode, providerMessage, providerType);
        }
        return new TaxonomyError(ErrorType.UNCLASSIFIED, statusCode,
                "HTTP " + statusCode + ": " + abbreviate(body), null);
    }

    /**
     * Parses {@code {"error":{"message":..,"type":..,"code":..}}} or {@code {"error":"..."}}.
     */
    public static Optional<ProviderError> parseProviderError(ObjectMapper objectMapper, String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return Optional.of(new ProviderError(error.asText(), null));
            }
            if (error.isObject()) {
                String message = text(error.path("message"));
                String type = text(error.path("type"));
                if (type.isEmpty()) {
                    type = text(error.path("code"));
                }
                if (message.isEmpty() && type.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new ProviderError(
                        message.isEmpty() ? type : message,
                        type.isEmpty() ? null : type));
            }
        } catch (Exception e) {
            // Not JSON; caller falls back to the raw body
        }
        return Optional.empty();
    }

    /**
     * Text of a node, or empty for missing, null and non-textual nodes.
     * Numeric codes are rendered as text.
     */
    public static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : "";
    }

    public static Integer intHeader(HttpHeaders headers, String name) {
        return headers.firstValue(name)
                .map(String::trim)
                .flatMap(AdapterSupport::parseInt)
                .orElse(null);
    }

    /**
     * Reads a reset header holding either epoch seconds or a relative delay such as
     * {@code 20ms}, {@code 1s} or {@code 6m0s}.
     */
    public static Instant resetHeader(HttpHeaders headers, String name, Instant now) {
        Optional<String> value = headers.firstValue(name).map(String::trim);
        if (value.isEmpty() || value.get().isEmpty()) {
            return null;
        }
        String raw = value.get().toLowerCase(Locale.ROOT);
        try {
            long seconds = Long.parseLong(raw);
            return seconds >= EPOCH_SECONDS_FLOOR
                    ? Instant.ofEpochSecond(seconds)
                    : now.plusSeconds(seconds);
        } catch (NumberFormatException ignored) {
            // Not a plain number, try the relative delay form
        }
        Duration delay = parseRelativeDelay(raw);
        return delay != null ? now.plus(delay) : null;
    }

    static Duration parseRelativeDelay(String raw) {
        Matcher matcher = DURATION_PART.matcher(raw);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                return null;
            }
            double amount = Double.parseDouble(matcher.group(1));
            long millis = switch (matcher.group(2)) {
                case "ms" -> Math.round(amount);
                case "s" -> Math.round(amount * 1_000);
                case "m" -> Math.round(amount * 60_000);
                case "h" -> Math.round(amount * 3_600_000);
                default -> 0L;
            };
            total = total.plusMillis(millis);
            consumed = matcher.end();
        }
        return consumed == raw.length() && consumed > 0 ? total : null;
    }

    static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_RAW_BODY ? body : body.substring(0, MAX_RAW_BODY) + "...";
    }

    private static Optional<Integer> parseInt(String value) {
        try {
            return Optional.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    /**
     * Error details a provider put in its response body.
     */
    public record ProviderError(String message, String type) {
    }
}
