package fr.lapetina.llm.verifier.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.domain.adapter.AdapterRegistry;
import fr.lapetina.llm.verifier.domain.adapter.AdapterSupport;
import fr.lapetina.llm.verifier.domain.adapter.ChunkStream;
import fr.lapetina.llm.verifier.domain.adapter.ProviderAdapter;
import fr.lapetina.llm.verifier.domain.model.ChatRequest;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.domain.model.Model;
import fr.lapetina.llm.verifier.domain.model.ProbeKind;
import fr.lapetina.llm.verifier.domain.model.ProbeRequest;
import fr.lapetina.llm.verifier.domain.model.ProbeResult;
import fr.lapetina.llm.verifier.domain.model.Provider;
import fr.lapetina.llm.verifier.domain.model.RateLimitInfo;
import fr.lapetina.llm.verifier.domain.model.StreamingChunk;
import fr.lapetina.llm.verifier.domain.model.TaxonomyError;
import fr.lapetina.llm.verifier.infrastructure.config.VerifierConfig;
import fr.lapetina.llm.verifier.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.GZIPInputStream;

/**
 * HTTP client running probes against OpenAI-compatible provider endpoints.
 *
 * Uses java.net.http.HttpClient. Every probe carries a hard deadline: non-streaming
 * exchanges are bounded with {@code orTimeout} and cancelled on expiry, streaming
 * exchanges are bounded by a watchdog that closes the response stream.
 * Includes a circuit breaker per provider.
 *
 * <p>{@link #probe(ProbeRequest)} never throws; every failure becomes a failed
 * {@link ProbeResult} carrying a classified error.
 */
public class ProbeClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProbeClient.class);

    static final String CIRCUIT_OPEN_MESSAGE = "Circuit breaker open";

    private final HttpClient httpClient;
    private final AdapterRegistry adapters;
    private final MetricsRegistry metrics;
    private final ObjectMapper objectMapper;
    private final Settings settings;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService watchdog;

    public ProbeClient(AdapterRegistry adapters, MetricsRegistry metrics, Settings settings) {
        this.adapters = adapters;
        this.metrics = metrics;
        this.settings = settings;
        this.objectMapper = AdapterSupport.newObjectMapper();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "probe-deadline-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    public ProbeClient(AdapterRegistry adapters, MetricsRegistry metrics) {
        this(adapters, metrics, Settings.DEFAULT);
    }

    /**
     * Runs one probe and blocks until it completes or its deadline passes.
     */
    public ProbeResult probe(ProbeRequest request) {
        Provider provider = request.provider();
        Optional<ProviderAdapter> adapter = adapters.resolve(provider.adapterName());
        if (adapter.isEmpty()) {
            log.warn("No adapter for provider: provider={}, adapter={}", provider.name(), provider.adapterName());
            return record(request, ProbeResult.failed(request.kind(), TaxonomyError.of(
                    ErrorType.NOT_FOUND, null, "Unknown provider adapter: " + provider.adapterName())));
        }

        Optional<CircuitBreaker> breaker = circuitBreaker(provider.name());
        if (breaker.isPresent() && !breaker.get().allowRequest()) {
            log.warn("Probe blocked by circuit breaker: provider={}, model={}, kind={}",
                    provider.name(), request.model().id(), request.kind());
            return record(request, ProbeResult.failed(request.kind(), TaxonomyError.transport(CIRCUIT_OPEN_MESSAGE)));
        }

        log.debug("Probe started: provider={}, model={}, kind={}, timeout={}",
                provider.name(), request.model().id(), request.kind(), request.timeout());

        ProbeResult result;
        try {
            result = switch (request.kind()) {
                case EXISTENCE -> probeExistence(request, adapter.get());
                case RESPONSIVENESS, STREAMING -> probeStreaming(request, adapter.get());
                case FUNCTION_CALLING, VISION -> probeChatFeature(request, adapter.get());
                case EMBEDDINGS -> probeEmbeddings(request, adapter.get());
            };
        } catch (RuntimeException e) {
            log.error("Probe failed unexpectedly: provider={}, model={}, kind={}",
                    provider.name(), request.model().id(), request.kind(), e);
            result = ProbeResult.failed(request.kind(), TaxonomyError.of(
                    ErrorType.UNCLASSIFIED, null, e.getClass().getSimpleName() + ": " + e.getMessage()));
        }

        ProbeResult outcome = result;
        breaker.ifPresent(b -> updateBreaker(b, outcome));
        return record(request, outcome);
    }

    /**
     * Lists the models a provider exposes through {@code GET {base}/models}.
     * Completes with an empty list when discovery fails.
     */
    public CompletableFuture<List<Model>> discoverModels(Provider provider, String credential) {
        HttpRequest request = authorized(HttpRequest.newBuilder(provider.endpoint("/models")), credential)
                .timeout(settings.requestTimeout())
                .GET()
                .build();

        log.debug("Model discovery started: provider={}, uri={}", provider.name(), request.uri());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() != 200) {
                        log.warn("Model discovery failed: provider={}, status={}",
                                provider.name(), response.statusCode());
                        return List.<Model>of();
                    }
                    return parseModelList(provider, response.body());
                })
                .exceptionally(ex -> {
                    log.warn("Model discovery error: provider={}, error={}", provider.name(), ex.getMessage());
                    return List.of();
                });
    }

    private List<Model> parseModelList(Provider provider, String body) {
        List<Model> models = new ArrayList<>();
        try {
            for (JsonNode entry : objectMapper.readTree(body).path("data")) {
                String id = AdapterSupport.text(entry.path("id"));
                if (!id.isEmpty()) {
                    models.add(Model.of(provider.name(), id));
                }
            }
        } catch (IOException e) {
            log.warn("Model list could not be parsed: provider={}, error={}", provider.name(), e.getMessage());
        }
        log.info("Models discovered: provider={}, count={}", provider.name(), models.size());
        return models;
    }

    // ------------------------------------------------------------------
    // Existence
    // ------------------------------------------------------------------

    private ProbeResult probeExistence(ProbeRequest request, ProviderAdapter adapter) {
        HttpRequest httpRequest = authorized(
                HttpRequest.newBuilder(request.provider().endpoint("/models/" + request.model().id())),
                request.credential())
                .GET()
                .build();

        long start = System.nanoTime();
        Exchange exchange = exchange(httpRequest, request.timeout());
        Duration latency = elapsedSince(start);

        if (exchange.failure() != null) {
            return transportFailure(request, exchange.failure(), latency);
        }
        if (exchange.status() != 200) {
            return httpFailure(request, adapter, exchange, latency);
        }
        return ProbeResult.builder(ProbeKind.EXISTENCE)
                .passed(true)
                .httpStatus(200)
                .latency(latency)
                .evidence(exchange.body())
                .transportOptimized(exchange.compressed())
                .rateLimit(rateLimit(adapter, exchange.headers()))
                .build();
    }

    // ------------------------------------------------------------------
    // Responsiveness and streaming
    // ------------------------------------------------------------------

    private ProbeResult probeStreaming(ProbeRequest request, ProviderAdapter adapter) {
        ChatRequest payload = payloadFor(request, adapter).withStream(true);
        HttpRequest httpRequest = chatRequest(request, payload).build();

        long start = System.nanoTime();
        long deadlineNanos = start + request.timeout().toNanos();
        AtomicBoolean deadlineHit = new AtomicBoolean(false);
        AtomicReference<AutoCloseable> closeOnDeadline = new AtomicReference<>();

        CompletableFuture<HttpResponse<InputStream>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
        HttpResponse<InputStream> response;
        try {
            response = future.orTimeout(request.timeout().toMillis(), TimeUnit.MILLISECONDS).get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return transportFailure(request, e, elapsedSince(start));
        } catch (ExecutionException e) {
            future.cancel(true);
            return transportFailure(request, e.getCause(), elapsedSince(start));
        }

        InputStream raw = response.body();
        closeOnDeadline.set(raw);
        ScheduledFuture<?> guard = watchdog.schedule(() -> {
            deadlineHit.set(true);
            closeQuietly(closeOnDeadline.get(), request);
        }, Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);

        try {
            boolean compressed = isGzip(response.headers());
            RateLimitInfo rateLimit = rateLimit(adapter, response.headers());

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                String body = readBody(raw, compressed);
                return httpFailure(request, adapter,
                        new Exchange(response.statusCode(), body, response.headers(), compressed, null),
                        elapsedSince(start));
            }

            InputStream body = compressed ? new GZIPInputStream(raw) : raw;
            try (ChunkStream chunks = adapter.parseStream(body)) {
                closeOnDeadline.set(chunks);
                return consumeStream(request, chunks, start, deadlineHit, response.statusCode(),
                        compressed, rateLimit);
            }
        } catch (IOException | UncheckedIOException e) {
            if (deadlineHit.get()) {
                return deadlineExceeded(request, elapsedSince(start));
            }
            return transportFailure(request, e, elapsedSince(start));
        } finally {
            guard.cancel(false);
            closeQuietly(raw, request);
        }
    }

    private ProbeResult consumeStream(
            ProbeRequest request,
            ChunkStream chunks,
            long start,
            AtomicBoolean deadlineHit,
            int status,
            boolean compressed,
            RateLimitInfo rateLimit
    ) {
        Duration ttft = null;
        boolean terminal = false;
        String firstError = null;
        StringBuilder content = new StringBuilder();

        for (StreamingChunk chunk : chunks) {
            if (chunk.isError()) {
                log.debug("Malformed stream event: provider={}, model={}, error={}",
                        request.provider().name(), request.model().id(), chunk.error());
                if (firstError == null) {
                    firstError = chunk.error();
                }
                continue;
            }
            if (chunk.hasContent()) {
                if (ttft == null) {
                    ttft = elapsedSince(start);
                }
                if (content.length() < ProbeResult.MAX_EVIDENCE_LENGTH) {
                    content.append(chunk.content());
                }
            }
            if (chunk.finish()) {
                terminal = true;
            }
        }
        Duration total = elapsedSince(start);

        if (deadlineHit.get() && !terminal) {
            return deadlineExceeded(request, total);
        }

        ProbeResult.Builder builder = ProbeResult.builder(request.kind())
                .httpStatus(status)
                .latency(total)
                .timeToFirstToken(ttft)
                .evidence(content.toString())
                .transportOptimized(compressed)
                .rateLimit(rateLimit);

        if (request.kind() == ProbeKind.RESPONSIVENESS) {
            ResponsivenessCriteria.Verdict verdict = settings.criteria().evaluate(total, ttft, terminal);
            if (!verdict.passed()) {
                log.info("Responsiveness criteria not met: provider={}, model={}, reason={}",
                        request.provider().name(), request.model().id(), verdict.reason());
                builder.evidence(verdict.reason());
            }
            return builder.passed(verdict.passed()).build();
        }

        if (ttft != null) {
            return builder.passed(true).build();
        }
        if (firstError != null) {
            return builder.error(TaxonomyError.parse(firstError)).build();
        }
        return builder.passed(false).evidence("No content chunk before end of stream").build();
    }

    // ------------------------------------------------------------------
    // Feature probes
    // ------------------------------------------------------------------

    private ProbeResult probeChatFeature(ProbeRequest request, ProviderAdapter adapter) {
        ChatRequest payload = payloadFor(request, adapter).withStream(false);
        long start = System.nanoTime();
        Exchange exchange = exchange(chatRequest(request, payload).build(), request.timeout());
        Duration latency = elapsedSince(start);

        if (exchange.failure() != null) {
            return transportFailure(request, exchange.failure(), latency);
        }
        if (exchange.status() < 200 || exchange.status() >= 300) {
            return httpFailure(request, adapter, exchange, latency);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(exchange.body());
        } catch (JsonProcessingException e) {
            return completed(request, adapter, exchange, latency)
                    .error(TaxonomyError.parse("Invalid JSON response: " + e.getOriginalMessage()))
                    .build();
        }

        JsonNode message = root.path("choices").path(0).path("message");
        ProbeResult.Builder builder = completed(request, adapter, exchange, latency);
        if (request.kind() == ProbeKind.FUNCTION_CALLING) {
            String function = AdapterSupport.text(message.path("tool_calls").path(0).path("function").path("name"));
            return function.isEmpty()
                    ? builder.passed(false).evidence("No tool call in response").build()
                    : builder.passed(true).evidence(function).build();
        }
        String content = AdapterSupport.text(message.path("content"));
        return content.isBlank()
                ? builder.passed(false).evidence("Empty vision response").build()
                : builder.passed(true).evidence(content).build();
    }

    private ProbeResult probeEmbeddings(ProbeRequest request, ProviderAdapter adapter) {
        String body;
        try {
            body = objectMapper.writeValueAsString(ProbePayloads.embeddingsBody(request.model().id()));
        } catch (IOException e) {
            return ProbeResult.failed(ProbeKind.EMBEDDINGS, TaxonomyError.parse(e.getMessage()));
        }
        HttpRequest httpRequest = authorized(
                HttpRequest.newBuilder(request.provider().endpoint("/embeddings")), request.credential())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        long start = System.nanoTime();
        Exchange exchange = exchange(httpRequest, request.timeout());
        Duration latency = elapsedSince(start);

        if (exchange.failure() != null) {
            return transportFailure(request, exchange.failure(), latency);
        }
        if (exchange.status() < 200 || exchange.status() >= 300) {
            return httpFailure(request, adapter, exchange, latency);
        }

        JsonNode vector;
        try {
            vector = objectMapper.readTree(exchange.body()).path("data").path(0).path("embedding");
        } catch (JsonProcessingException e) {
            return completed(request, adapter, exchange, latency)
                    .error(TaxonomyError.parse("Invalid JSON response: " + e.getOriginalMessage()))
                    .build();
        }

        ProbeResult.Builder builder = completed(request, adapter, exchange, latency);
        if (!vector.isArray() || vector.isEmpty()) {
            return builder.error(TaxonomyError.parse("Missing embedding vector")).build();
        }
        for (JsonNode value : vector) {
            if (!value.isNumber()) {
                return builder.error(TaxonomyError.parse("Embedding vector is not numeric")).build();
            }
        }
        int expected = settings.expectedEmbeddingDimensions();
        if (expected > 0 && vector.size() != expected) {
            return builder.passed(false)
                    .evidence("Embedding dimensions " + vector.size() + ", expected " + expected)
                    .build();
        }
        return builder.passed(true).evidence("dimensions=" + vector.size()).build();
    }

    // ------------------------------------------------------------------
    // Exchange plumbing
    // ------------------------------------------------------------------

    /**
     * Sends a non-streaming request with a hard deadline. The in-flight call is
     * cancelled when the deadline passes.
     */
    private Exchange exchange(HttpRequest httpRequest, Duration timeout) {
        CompletableFuture<HttpResponse<byte[]>> future =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        try {
            HttpResponse<byte[]> response = future
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .get();
            boolean compressed = isGzip(response.headers());
            String body = decode(response.body(), compressed);
            return new Exchange(response.statusCode(), body, response.headers(), compressed, null);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Exchange.failed(e);
        } catch (ExecutionException e) {
            future.cancel(true);
            return Exchange.failed(e.getCause());
        } catch (IOException e) {
            return Exchange.failed(e);
        }
    }

    private HttpRequest.Builder chatRequest(ProbeRequest request, ChatRequest payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload.toBody(request.model().id()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize probe payload", e);
        }
        return authorized(
                HttpRequest.newBuilder(request.provider().endpoint("/chat/completions")), request.credential())
                .header("Content-Type", "application/json")
                .header("Accept-Encoding", "gzip")
                .POST(HttpRequest.BodyPublishers.ofString(body));
    }

    private static HttpRequest.Builder authorized(HttpRequest.Builder builder, String credential) {
        if (credential != null && !credential.isEmpty()) {
            builder.header("Authorization", "Bearer " + credential);
        }
        return builder;
    }

    private static ChatRequest payloadFor(ProbeRequest request, ProviderAdapter adapter) {
        ChatRequest payload = request.payload() != null ? request.payload() : ProbePayloads.forKind(request.kind());
        return adapter.optimize(payload);
    }

    private ProbeResult.Builder completed(
            ProbeRequest request,
            ProviderAdapter adapter,
            Exchange exchange,
            Duration latency
    ) {
        return ProbeResult.builder(request.kind())
                .httpStatus(exchange.status())
                .latency(latency)
                .transportOptimized(exchange.compressed())
                .rateLimit(rateLimit(adapter, exchange.headers()));
    }

    private ProbeResult httpFailure(
            ProbeRequest request,
            ProviderAdapter adapter,
            Exchange exchange,
            Duration latency
    ) {
        TaxonomyError error = adapter.classifyError(exchange.status(), exchange.body());
        log.warn("Probe failed with HTTP error: provider={}, model={}, kind={}, status={}, errorType={}, latencyMs={}",
                request.provider().name(), request.model().id(), request.kind(),
                exchange.status(), error.type(), latency.toMillis());
        return completed(request, adapter, exchange, latency)
                .error(error)
                .evidence(exchange.body())
                .build();
    }

    private ProbeResult transportFailure(ProbeRequest request, Throwable ex, Duration latency) {
        Throwable cause = unwrap(ex);
        String message = describe(cause);
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            log.error("Probe timeout: provider={}, model={}, kind={}, timeout={}",
                    request.provider().name(), request.model().id(), request.kind(), request.timeout());
        } else if (isConnectionFailure(cause)) {
            log.error("Provider connection error: provider={}, model={}, kind={}, errorType={}, error={}",
                    request.provider().name(), request.model().id(), request.kind(),
                    cause.getClass().getSimpleName(), cause.getMessage());
        } else {
            log.error("Probe transport failure: provider={}, model={}, kind={}, errorType={}, error={}",
                    request.provider().name(), request.model().id(), request.kind(),
                    cause.getClass().getSimpleName(), cause.getMessage(), cause);
        }
        return ProbeResult.builder(request.kind())
                .latency(latency)
                .error(TaxonomyError.transport(message))
                .build();
    }

    private ProbeResult deadlineExceeded(ProbeRequest request, Duration latency) {
        log.error("Probe deadline exceeded: provider={}, model={}, kind={}, timeout={}",
                request.provider().name(), request.model().id(), request.kind(), request.timeout());
        return ProbeResult.builder(request.kind())
                .latency(latency)
                .error(TaxonomyError.transport("Probe deadline of " + request.timeout().toMillis() + "ms exceeded"))
                .build();
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException
                || cause instanceof UncheckedIOException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static boolean isConnectionFailure(Throwable cause) {
        return cause instanceof ConnectException
                || cause instanceof HttpConnectTimeoutException
                || cause instanceof UnknownHostException
                || cause instanceof IOException;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "Request timed out";
        }
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private RateLimitInfo rateLimit(ProviderAdapter adapter, HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        RateLimitInfo info = adapter.rateLimitInfo(headers);
        return info == null || info.isEmpty() ? null : info;
    }

    private static boolean isGzip(HttpHeaders headers) {
        return headers.firstValue("Content-Encoding")
                .map(v -> v.toLowerCase(Locale.ROOT).contains("gzip"))
                .orElse(false);
    }

    private static String decode(byte[] body, boolean compressed) throws IOException {
        if (body == null || body.length == 0) {
            return "";
        }
        if (!compressed) {
            return new String(body, StandardCharsets.UTF_8);
        }
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String readBody(InputStream raw, boolean compressed) throws IOException {
        byte[] bytes = raw.readAllBytes();
        return decode(bytes, compressed);
    }

    private static void closeQuietly(AutoCloseable closeable, ProbeRequest request) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("Error closing probe response: provider={}, kind={}, error={}",
                    request.provider().name(), request.kind(), e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private ProbeResult record(ProbeRequest request, ProbeResult result) {
        String provider = request.provider().name();
        if (metrics != null) {
            metrics.recordProbe(provider, result.kind(), result.latency(), result.passed());
            if (result.error() != null) {
                metrics.incrementErrorCount(provider, result.error().type());
            }
        }
        log.info("Probe completed: provider={}, model={}, kind={}, passed={}, status={}, latencyMs={}, ttftMs={}",
                provider, request.model().id(), result.kind(), result.passed(), result.httpStatus(),
                result.latency().toMillis(),
                result.timeToFirstToken() != null ? result.timeToFirstToken().toMillis() : null);
        return result;
    }

    // ------------------------------------------------------------------
    // Circuit breakers
    // ------------------------------------------------------------------

    private void updateBreaker(CircuitBreaker breaker, ProbeResult result) {
        ErrorType type = result.error() != null ? result.error().type() : null;
        if (type == ErrorType.TRANSPORT_ERROR || type == ErrorType.SERVER_ERROR) {
            breaker.recordFailure();
        } else {
            breaker.recordSuccess();
        }
    }

    private Optional<CircuitBreaker> circuitBreaker(String provider) {
        if (settings.failureThreshold() <= 0) {
            return Optional.empty();
        }
        return Optional.of(circuitBreakers.computeIfAbsent(provider.toLowerCase(Locale.ROOT), id ->
                new CircuitBreaker(provider, settings.failureThreshold(), settings.recoveryTimeout())
        ));
    }

    /**
     * Gets the circuit breaker for a provider, if one has been created.
     */
    public Optional<CircuitBreaker> getCircuitBreaker(String provider) {
        return Optional.ofNullable(circuitBreakers.get(provider.toLowerCase(Locale.ROOT)));
    }

    /**
     * Resets the circuit breaker for a provider.
     */
    public void resetCircuitBreaker(String provider) {
        getCircuitBreaker(provider).ifPresent(b -> b.forceState(CircuitBreaker.State.CLOSED));
    }

    public Settings getSettings() {
        return settings;
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
        log.info("ProbeClient closed");
    }

    private record Exchange(int status, String body, HttpHeaders headers, boolean compressed, Throwable failure) {
        static Exchange failed(Throwable failure) {
            return new Exchange(0, "", null, false, failure);
        }
    }

    /**
     * Probe client tuning.
     *
     * @param failureThreshold consecutive failures before a provider's circuit opens, 0 disables breakers
     */
    public record Settings(
            Duration connectTimeout,
            Duration requestTimeout,
            ResponsivenessCriteria criteria,
            int expectedEmbeddingDimensions,
            int failureThreshold,
            Duration recoveryTimeout
    ) {
        public static final Settings DEFAULT = new Settings(
                Duration.ofSeconds(10),
                Duration.ofSeconds(90),
                ResponsivenessCriteria.DEFAULT,
                0,
                5,
                Duration.ofSeconds(30));

        public Settings {
            if (expectedEmbeddingDimensions < 0) {
                throw new IllegalArgumentException("Expected embedding dimensions must not be negative");
            }
            if (failureThreshold < 0) {
                throw new IllegalArgumentException("Failure threshold must not be negative");
            }
        }

        public static Settings from(VerifierConfig.ProbeConfig probe, VerifierConfig.ConcurrencyConfig concurrency) {
            return new Settings(
                    Duration.ofMillis(probe.getConnectTimeoutMs()),
                    probe.requestTimeout(),
                    new ResponsivenessCriteria(probe.ttftCeiling(), probe.totalCeiling()),
                    probe.getExpectedEmbeddingDimensions(),
                    concurrency.getCircuitBreakerFailureThreshold(),
                    Duration.ofMillis(concurrency.getCircuitBreakerRecoveryMs()));
        }
    }
}
