package fr.lapetina.llm.verifier.orchestrator;

import fr.lapetina.llm.verifier.domain.adapter.AdapterRegistry;
import fr.lapetina.llm.verifier.domain.adapter.ProviderAdapter;
import fr.lapetina.llm.verifier.domain.event.Event;
import fr.lapetina.llm.verifier.domain.event.EventBus;
import fr.lapetina.llm.verifier.domain.event.EventType;
import fr.lapetina.llm.verifier.domain.event.Severity;
import fr.lapetina.llm.verifier.domain.event.VerificationState;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.domain.model.Model;
import fr.lapetina.llm.verifier.domain.model.ModelFeature;
import fr.lapetina.llm.verifier.domain.model.ProbeKind;
import fr.lapetina.llm.verifier.domain.model.ProbeRequest;
import fr.lapetina.llm.verifier.domain.model.ProbeResult;
import fr.lapetina.llm.verifier.domain.model.Provider;
import fr.lapetina.llm.verifier.domain.model.TaxonomyError;
import fr.lapetina.llm.verifier.domain.model.VerificationResult;
import fr.lapetina.llm.verifier.domain.scoring.ScoreCalculator;
import fr.lapetina.llm.verifier.infrastructure.cache.CacheKeys;
import fr.lapetina.llm.verifier.infrastructure.cache.CacheLookup;
import fr.lapetina.llm.verifier.infrastructure.cache.MultiLevelCache;
import fr.lapetina.llm.verifier.infrastructure.config.CredentialResolver;
import fr.lapetina.llm.verifier.infrastructure.http.ProbeClient;
import fr.lapetina.llm.verifier.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.verifier.infrastructure.provider.ProviderRegistry;
import fr.lapetina.llm.verifier.infrastructure.store.VerificationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs the probe sequence for (provider, model) pairs and produces scored results.
 *
 * <p>Per key the state moves {@code IDLE -> PROBING -> SCORING -> DONE}:
 * <ol>
 *   <li>Unless refreshing, a cached verification is returned without any HTTP call</li>
 *   <li>Concurrent requests for the same key share one in-flight future; a refresh only
 *       joins another refresh, a plain request may join either</li>
 *   <li>Existence, responsiveness, streaming and the model's feature probes run in
 *       parallel on the probe workers, each coalesced and cached per probe kind</li>
 *   <li>At most the adapter's batch size of probes run at once per provider; the rest
 *       queue without holding a thread</li>
 *   <li>The results are scored, cached, stored and announced on the event bus</li>
 * </ol>
 * A failing probe never aborts the others; the score is computed on whatever was gathered.
 * Returned futures complete normally with a result, even for unknown providers.
 */
public final class VerificationOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

    static final String EVENT_SOURCE = "verification-orchestrator";
    static final String UNKNOWN_PROVIDER = "Unknown provider";
    private static final String REFRESH_SUFFIX = "#refresh";

    private static final List<ProbeKind> BASE_PROBES =
            List.of(ProbeKind.EXISTENCE, ProbeKind.RESPONSIVENESS, ProbeKind.STREAMING);

    private final ProviderRegistry providers;
    private final AdapterRegistry adapters;
    private final ProbeClient probeClient;
    private final ScoreCalculator calculator;
    private final MultiLevelCache<VerificationResult> verificationCache;
    private final MultiLevelCache<ProbeResult> probeCache;
    private final VerificationStore store;
    private final EventBus eventBus;
    private final CredentialResolver credentials;
    private final MetricsRegistry metrics;
    private final Duration probeTimeout;
    private final Set<ModelFeature> defaultFeatures;
    private final Clock clock;

    private final ProviderConcurrencyLimiter limiter = new ProviderConcurrencyLimiter();
    private final Map<String, CompletableFuture<VerificationResult>> inFlightVerifications = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<ProbeResult>> inFlightProbes = new ConcurrentHashMap<>();
    private final Map<String, VerificationState> states = new ConcurrentHashMap<>();

    private final ExecutorService probeWorkers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private VerificationOrchestrator(Builder builder) {
        this.providers = Objects.requireNonNull(builder.providers, "Provider registry is required");
        this.adapters = Objects.requireNonNull(builder.adapters, "Adapter registry is required");
        this.probeClient = Objects.requireNonNull(builder.probeClient, "Probe client is required");
        this.calculator = Objects.requireNonNull(builder.calculator, "Score calculator is required");
        this.verificationCache = Objects.requireNonNull(builder.verificationCache, "Verification cache is required");
        this.probeCache = Objects.requireNonNull(builder.probeCache, "Probe cache is required");
        this.store = Objects.requireNonNull(builder.store, "Verification store is required");
        this.eventBus = Objects.requireNonNull(builder.eventBus, "Event bus is required");
        this.credentials = builder.credentials;
        this.metrics = builder.metrics;
        this.probeTimeout = builder.probeTimeout;
        this.defaultFeatures = builder.defaultFeatures;
        this.clock = builder.clock;

        this.probeWorkers = Executors.newFixedThreadPool(builder.workerThreads, new NamedThreadFactory("probe-worker"));

        log.info("VerificationOrchestrator created: workerThreads={}, probeTimeout={}, defaultFeatures={}",
                builder.workerThreads, probeTimeout, defaultFeatures);
    }

    public CompletableFuture<VerificationResult> verify(String provider, String model) {
        return verify(VerificationRequest.of(provider, model));
    }

    /**
     * Verifies again, ignoring and then overwriting cached results.
     */
    public CompletableFuture<VerificationResult> reverify(String provider, String model) {
        return verify(VerificationRequest.refresh(provider, model));
    }

    public CompletableFuture<VerificationResult> verify(VerificationRequest request) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Orchestrator is closed"));
        }

        Optional<Provider> provider = providers.getProvider(request.provider());
        Optional<ProviderAdapter> adapter = provider.flatMap(p -> adapters.resolve(p.adapterName()));
        if (provider.isEmpty() || adapter.isEmpty()) {
            return CompletableFuture.completedFuture(unknownProvider(request));
        }

        String key = CacheKeys.verification(provider.get().name(), request.model());
        if (!request.forceRefresh()) {
            CacheLookup<VerificationResult> cached = verificationCache.get(key);
            if (cached.hit()) {
                log.debug("Verification served from cache: provider={}, model={}, score={}",
                        request.provider(), request.model(), cached.value().score());
                return CompletableFuture.completedFuture(cached.value());
            }
        }

        CompletableFuture<VerificationResult> refreshing = inFlightVerifications.get(key + REFRESH_SUFFIX);
        if (refreshing != null && !request.forceRefresh()) {
            log.debug("Verification coalesced with in-flight refresh: provider={}, model={}",
                    request.provider(), request.model());
            return refreshing;
        }
        String flightKey = request.forceRefresh() ? key + REFRESH_SUFFIX : key;
        CompletableFuture<VerificationResult> created = new CompletableFuture<>();
        CompletableFuture<VerificationResult> existing = inFlightVerifications.putIfAbsent(flightKey, created);
        if (existing != null) {
            log.debug("Verification coalesced with in-flight run: provider={}, model={}, forceRefresh={}",
                    request.provider(), request.model(), request.forceRefresh());
            return existing;
        }

        Model model = providers.getModel(provider.get().name(), request.model())
                .orElseGet(() -> Model.of(provider.get().name(), request.model()));
        CompletableFuture<VerificationResult> run;
        try {
            run = start(provider.get(), adapter.get(), model, key, request.forceRefresh());
        } catch (RuntimeException e) {
            run = CompletableFuture.failedFuture(e);
        }
        run.whenComplete((result, ex) -> {
            inFlightVerifications.remove(flightKey, created);
            if (ex != null) {
                log.error("Verification failed unexpectedly: provider={}, model={}",
                        request.provider(), request.model(), ex);
                created.completeExceptionally(ex);
            } else {
                created.complete(result);
            }
        });
        return created;
    }

    /**
     * Verifies every request concurrently; the future completes when all have.
     */
    public CompletableFuture<List<VerificationResult>> verifyAll(Collection<VerificationRequest> requests) {
        List<CompletableFuture<VerificationResult>> futures = requests.stream()
                .map(this::verify)
                .toList();
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Verifies every model known to the provider registry.
     */
    public CompletableFuture<List<VerificationResult>> verifyAllRegistered(boolean forceRefresh) {
        List<VerificationRequest> requests = providers.getAllModels().stream()
                .map(m -> new VerificationRequest(m.provider(), m.id(), forceRefresh))
                .toList();
        return verifyAll(requests);
    }

    public VerificationState getState(String provider, String model) {
        return states.getOrDefault(CacheKeys.verification(provider, model), VerificationState.IDLE);
    }

    public int getInFlightCount() {
        return inFlightVerifications.size();
    }

    ProviderConcurrencyLimiter limiter() {
        return limiter;
    }

    /**
     * Starts the probes and chains scoring on their completion; no thread waits in between.
     * Scoring runs on the thread finishing the last probe, or inline when every probe was cached.
     */
    private CompletableFuture<VerificationResult> start(
            Provider provider,
            ProviderAdapter adapter,
            Model model,
            String key,
            boolean force
    ) {
        Map<String, String> context = Map.of("provider", provider.name(), "model", model.id());
        return withMdc(context, () -> {
            states.put(key, VerificationState.PROBING);
            List<ProbeKind> kinds = probeKinds(model);
            log.info("Verification started: provider={}, model={}, probes={}, forceRefresh={}",
                    provider.name(), model.id(), kinds, force);
            publish(EventType.VERIFICATION_STARTED, Severity.INFO, basePayload(provider.name(), model.id()));

            String credential = credentials.resolve(provider.credentialRef());
            List<CompletableFuture<ProbeResult>> futures = new ArrayList<>(kinds.size());
            for (ProbeKind kind : kinds) {
                futures.add(probe(provider, adapter, model, credential, kind, force, context));
            }
            return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                    .thenApply(ignored -> withMdc(context, () -> score(provider, model, key,
                            futures.stream().map(CompletableFuture::join).toList())));
        });
    }

    private VerificationResult score(Provider provider, Model model, String key, List<ProbeResult> probes) {
        states.put(key, VerificationState.SCORING);
        VerificationResult result = calculator.score(provider.name(), model.id(), probes, clock.instant());

        Optional<VerificationResult> previous = latestStored(provider.name(), model.id());
        verificationCache.set(key, result);
        saveResult(result);
        if (metrics != null) {
            metrics.recordScore(provider.name(), result.score());
        }
        announce(result, previous);

        states.put(key, VerificationState.DONE);
        log.info("Verification completed: provider={}, model={}, score={}, category={}, passed={}/{}",
                provider.name(), model.id(), result.score(), result.category(),
                result.passedCount(), probes.size());
        return result;
    }

    /**
     * One probe, served from the probe cache or coalesced with an identical in-flight probe.
     * A forced probe never joins a plain one, so it always reaches the provider.
     */
    private CompletableFuture<ProbeResult> probe(
            Provider provider,
            ProviderAdapter adapter,
            Model model,
            String credential,
            ProbeKind kind,
            boolean force,
            Map<String, String> context
    ) {
        String key = CacheKeys.probe(provider.name(), model.id(), kind);
        if (!force) {
            CacheLookup<ProbeResult> cached = probeCache.get(key);
            if (cached.hit()) {
                log.debug("Probe served from cache: provider={}, model={}, kind={}", provider.name(), model.id(), kind);
                return CompletableFuture.completedFuture(cached.value());
            }
            CompletableFuture<ProbeResult> refreshing = inFlightProbes.get(key + REFRESH_SUFFIX);
            if (refreshing != null) {
                return refreshing;
            }
        }

        String flightKey = force ? key + REFRESH_SUFFIX : key;
        CompletableFuture<ProbeResult> created = new CompletableFuture<>();
        CompletableFuture<ProbeResult> existing = inFlightProbes.putIfAbsent(flightKey, created);
        if (existing != null) {
            log.debug("Probe coalesced with in-flight probe: provider={}, model={}, kind={}",
                    provider.name(), model.id(), kind);
            return existing;
        }

        ProbeRequest request = new ProbeRequest(provider, model, credential, kind, null, probeTimeout);
        limiter.submit(provider, adapter, () -> withMdc(context, () -> runProbe(request, key)), probeWorkers)
                .whenComplete((result, ex) -> {
                    inFlightProbes.remove(flightKey, created);
                    if (ex != null) {
                        log.error("Probe could not be scheduled: provider={}, model={}, kind={}",
                                provider.name(), model.id(), kind, ex);
                        created.complete(ProbeResult.failed(kind, TaxonomyError.of(ErrorType.UNCLASSIFIED, null,
                                "Probe could not be scheduled: " + ex.getMessage())));
                    } else {
                        created.complete(result);
                    }
                });
        return created;
    }

    private ProbeResult runProbe(ProbeRequest request, String key) {
        try {
            ProbeResult result = probeClient.probe(request);
            probeCache.set(key, result);
            return result;
        } catch (RuntimeException e) {
            log.error("Probe worker failure: provider={}, model={}, kind={}",
                    request.provider().name(), request.model().id(), request.kind(), e);
            return ProbeResult.failed(request.kind(), TaxonomyError.of(ErrorType.UNCLASSIFIED, null, e.getMessage()));
        }
    }

    List<ProbeKind> probeKinds(Model model) {
        Set<ModelFeature> features = model.features().isEmpty() ? defaultFeatures : model.features();
        List<ProbeKind> kinds = new ArrayList<>(BASE_PROBES);
        EnumSet<ProbeKind> featureProbes = EnumSet.noneOf(ProbeKind.class);
        for (ModelFeature feature : features) {
            feature.featureProbe().ifPresent(featureProbes::add);
        }
        kinds.addAll(featureProbes);
        return kinds;
    }

    private VerificationResult unknownProvider(VerificationRequest request) {
        log.warn("Verification for unknown provider: provider={}, model={}", request.provider(), request.model());
        Model model = Model.of(request.provider(), request.model());
        VerificationResult result = allFailed(request.provider(), request.model(), probeKinds(model),
                TaxonomyError.of(ErrorType.NOT_FOUND, null, UNKNOWN_PROVIDER));
        Map<String, Object> payload = basePayload(request.provider(), request.model());
        payload.put("reason", UNKNOWN_PROVIDER);
        publish(EventType.VERIFICATION_FAILED, Severity.ERROR, payload);
        return result;
    }

    private VerificationResult allFailed(String provider, String model, List<ProbeKind> kinds, TaxonomyError error) {
        List<ProbeResult> probes = kinds.stream()
                .map(kind -> ProbeResult.failed(kind, error))
                .toList();
        return calculator.score(provider, model, probes, clock.instant());
    }

    private Optional<VerificationResult> latestStored(String provider, String model) {
        try {
            return store.latest(provider, model);
        } catch (RuntimeException e) {
            log.warn("Could not read previous result: provider={}, model={}, error={}", provider, model, e.getMessage());
            return Optional.empty();
        }
    }

    private void saveResult(VerificationResult result) {
        try {
            store.save(result);
        } catch (RuntimeException e) {
            log.error("Failed to store verification result: provider={}, model={}",
                    result.provider(), result.model(), e);
        }
    }

    private void announce(VerificationResult result, Optional<VerificationResult> previous) {
        Map<String, Object> payload = basePayload(result.provider(), result.model());
        payload.put("score", result.score());
        payload.put("category", result.category().getLabel());
        payload.put("passedProbes", result.passedCount());
        payload.put("totalProbes", result.probes().size());

        publish(EventType.VERIFICATION_COMPLETED, Severity.INFO, payload);

        if (result.allFailed()) {
            publish(EventType.VERIFICATION_FAILED, Severity.ERROR, payload);
        }

        previous.filter(p -> p.score() != result.score()).ifPresent(p -> {
            Map<String, Object> change = new LinkedHashMap<>(payload);
            change.put("previousScore", p.score());
            change.put("previousCategory", p.category().getLabel());
            Severity severity = result.score() < p.score() ? Severity.WARNING : Severity.INFO;
            publish(EventType.SCORE_CHANGED, severity, change);
        });
    }

    private void publish(EventType type, Severity severity, Map<String, Object> payload) {
        try {
            eventBus.publish(Event.of(type, severity, EVENT_SOURCE, payload));
        } catch (RuntimeException e) {
            log.error("Failed to publish event: type={}", type, e);
        }
    }

    private static <T> T withMdc(Map<String, String> context, Supplier<T> action) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        MDC.setContextMap(context);
        try {
            return action.get();
        } finally {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }

    private static Map<String, Object> basePayload(String provider, String model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("provider", provider);
        payload.put("model", model);
        return payload;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        shutdown(probeWorkers, "probe workers");
        log.info("VerificationOrchestrator closed");
    }

    private static void shutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in time, forcing shutdown: {}", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for VerificationOrchestrator.
     */
    public static final class Builder {
        private ProviderRegistry providers;
        private AdapterRegistry adapters;
        private ProbeClient probeClient;
        private ScoreCalculator calculator = new ScoreCalculator();
        private MultiLevelCache<VerificationResult> verificationCache;
        private MultiLevelCache<ProbeResult> probeCache;
        private VerificationStore store;
        private EventBus eventBus;
        private CredentialResolver credentials = new CredentialResolver();
        private MetricsRegistry metrics;
        private Duration probeTimeout = Duration.ofSeconds(90);
        private Set<ModelFeature> defaultFeatures = EnumSet.of(ModelFeature.FUNCTION_CALLING);
        private int workerThreads = 16;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder providers(ProviderRegistry providers) {
            this.providers = providers;
            return this;
        }

        public Builder adapters(AdapterRegistry adapters) {
            this.adapters = adapters;
            return this;
        }

        public Builder probeClient(ProbeClient probeClient) {
            this.probeClient = probeClient;
            return this;
        }

        public Builder calculator(ScoreCalculator calculator) {
            this.calculator = calculator;
            return this;
        }

        public Builder verificationCache(MultiLevelCache<VerificationResult> verificationCache) {
            this.verificationCache = verificationCache;
            return this;
        }

        public Builder probeCache(MultiLevelCache<ProbeResult> probeCache) {
            this.probeCache = probeCache;
            return this;
        }

        public Builder store(VerificationStore store) {
            this.store = store;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder credentials(CredentialResolver credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder probeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
            return this;
        }

        public Builder defaultFeatures(Set<ModelFeature> defaultFeatures) {
            this.defaultFeatures = defaultFeatures.isEmpty()
                    ? EnumSet.noneOf(ModelFeature.class)
                    : EnumSet.copyOf(defaultFeatures);
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public VerificationOrchestrator build() {
            return new VerificationOrchestrator(this);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String prefix) {
            this.prefix = prefix.toLowerCase(Locale.ROOT);
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
