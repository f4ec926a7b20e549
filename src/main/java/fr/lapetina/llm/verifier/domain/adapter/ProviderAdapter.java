package fr.lapetina.llm.verifier.domain.adapter;

import fr.lapetina.llm.verifier.domain.model.ChatRequest;
import fr.lapetina.llm.verifier.domain.model.RateLimitInfo;
import fr.lapetina.llm.verifier.domain.model.TaxonomyError;

import java.io.InputStream;
import java.net.http.HttpHeaders;

/**
 * Provider-specific behaviour behind one contract.
 *
 * <p>New providers are added by registering an implementation in the
 * {@link AdapterRegistry}; the orchestrator never needs to change.
 * Implementations must be thread-safe, they are shared across all probes.
 */
public interface ProviderAdapter {

    /**
     * Returns the adapter name used for registry lookup.
     */
    String name();

    /**
     * Applies provider-tuned defaults to a request.
     * Never drops user fields and never overwrites an explicit temperature or max tokens.
     *
     * @param request The caller's request
     * @return A tuned copy, or the same instance when nothing changes
     */
    ChatRequest optimize(ChatRequest request);

    /**
     * Wraps a server-sent-event body into a lazy, single-use chunk sequence.
     * The returned stream owns {@code body} and closes it when exhausted or closed.
     */
    ChunkStream parseStream(InputStream body);

    /**
     * Maps an HTTP error status and body to the error taxonomy.
     */
    TaxonomyError classifyError(int statusCode, String body);

    /**
     * Returns the safe number of concurrent probes for this provider.
     */
    int optimalBatchSize();

    /**
     * Extracts rate-limit metadata. Missing headers yield null fields, never a guess.
     */
    RateLimitInfo rateLimitInfo(HttpHeaders headers);
}
