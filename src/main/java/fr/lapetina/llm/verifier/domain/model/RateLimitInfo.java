package fr.lapetina.llm.verifier.domain.model;

import java.time.Instant;

/**
 * Rate-limit metadata read from response headers.
 * A field is null when the provider did not send the matching header.
 */
public record RateLimitInfo(
        Integer requestsPerMinute,
        Integer tokensPerMinute,
        Instant resetTime
) {
    private static final RateLimitInfo EMPTY = new RateLimitInfo(null, null, null);

    public static RateLimitInfo empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return requestsPerMinute == null && tokensPerMinute == null && resetTime == null;
    }
}
