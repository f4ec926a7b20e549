package fr.lapetina.llm.verifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.domain.adapter.AdapterRegistry;
import fr.lapetina.llm.verifier.domain.adapter.AdapterSupport;
import fr.lapetina.llm.verifier.domain.event.EventBus;
import fr.lapetina.llm.verifier.domain.event.EventType;
import fr.lapetina.llm.verifier.domain.event.InMemoryEventBus;
import fr.lapetina.llm.verifier.domain.model.Model;
import fr.lapetina.llm.verifier.domain.model.ProbeResult;
import fr.lapetina.llm.verifier.domain.model.Provider;
import fr.lapetina.llm.verifier.domain.model.VerificationResult;
import fr.lapetina.llm.verifier.domain.scoring.ScoreCalculator;
import fr.lapetina.llm.verifier.infrastructure.cache.CacheTier;
import fr.lapetina.llm.verifier.infrastructure.cache.MultiLevelCache;
import fr.lapetina.llm.verifier.infrastructure.cache.RedisCacheTier;
import fr.lapetina.llm.verifier.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.verifier.infrastructure.config.CredentialResolver;
import fr.lapetina.llm.verifier.infrastructure.config.VerifierConfig;
import fr.lapetina.llm.verifier.infrastructure.http.ProbeClient;
import fr.lapetina.llm.verifier.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.verifier.infrastructure.notification.NotificationDispatcher;
import fr.lapetina.llm.verifier.infrastructure.notification.channel.EmailChannel;
import fr.lapetina.llm.verifier.infrastructure.notification.channel.SlackWebhookChannel;
import fr.lapetina.llm.verifier.infrastructure.notification.channel.TelegramChannel;
import fr.lapetina.llm.verifier.infrastructure.provider.ProviderRegistry;
import fr.lapetina.llm.verifier.infrastructure.store.InMemoryVerificationStore;
import fr.lapetina.llm.verifier.infrastructure.store.VerificationStore;
import fr.lapetina.llm.verifier.orchestrator.VerificationOrchestrator;
import fr.lapetina.llm.verifier.orchestrator.VerificationScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds a fully wired verifier from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (VerifierFactory factory = VerifierFactory.create("config.yaml").start()) {
 *     VerificationResult result = factory.getOrchestrator().verify("openai", "gpt-4o").join();
 * }
 * }</pre>
 */
public class VerifierFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VerifierFactory.class);

    private final VerifierConfig config;
    private final MetricsRegistry metricsRegistry;
    private final AdapterRegistry adapterRegistry;
    private final ProviderRegistry providerRegistry;
    private final ProbeClient probeClient;
    private final MultiLevelCache<VerificationResult> verificationCache;
    private final MultiLevelCache<ProbeResult> probeCache;
    private final VerificationStore store;
    private final EventBus eventBus;
    private final VerificationOrchestrator orchestrator;
    private final NotificationDispatcher dispatcher;
    private final VerificationScheduler scheduler;
    private EventBus.Subscription notificationSubscription;

    protected VerifierFactory(VerifierConfig config, ProbeClient probeClientOverride) {
        this.config = config;

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        this.adapterRegistry = AdapterRegistry.withDefaults();

        this.providerRegistry = new ProviderRegistry();
        loadProviders();

        // Allow override for testing
        this.probeClient = probeClientOverride != null
                ? probeClientOverride
                : new ProbeClient(adapterRegistry, metricsRegistry,
                        ProbeClient.Settings.from(config.getProbe(), config.getConcurrency()));

        ObjectMapper mapper = AdapterSupport.newObjectMapper();
        this.verificationCache = MultiLevelCache.<VerificationResult>builder("verification")
                .distributed(distributedTier(mapper, VerificationResult.class, "verification"))
                .defaultTtl(config.getCache().defaultTtl())
                .cleanupInterval(Duration.ofMillis(config.getCache().getCleanupIntervalMs()))
                .enabled(config.getCache().isEnabled())
                .build();
        this.probeCache = MultiLevelCache.<ProbeResult>builder("probe")
                .distributed(distributedTier(mapper, ProbeResult.class, "probe"))
                .defaultTtl(config.getCache().defaultTtl())
                .cleanupInterval(Duration.ofMillis(config.getCache().getCleanupIntervalMs()))
                .enabled(config.getCache().isEnabled())
                .build();

        this.store = new InMemoryVerificationStore();
        this.eventBus = new InMemoryEventBus();

        this.orchestrator = VerificationOrchestrator.builder()
                .providers(providerRegistry)
                .adapters(adapterRegistry)
                .probeClient(probeClient)
                .calculator(new ScoreCalculator(config.getScoring().toWeights()))
                .verificationCache(verificationCache)
                .probeCache(probeCache)
                .store(store)
                .eventBus(eventBus)
                .credentials(new CredentialResolver())
                .metrics(metricsRegistry)
                .probeTimeout(config.getProbe().requestTimeout())
                .defaultFeatures(config.getProbe().defaultFeatureSet())
                .workerThreads(config.getConcurrency().getWorkerThreads())
                .build();

        this.dispatcher = config.getNotifications().isEnabled() ? createDispatcher() : null;

        long intervalMs = config.getScheduler().getIntervalMs();
        this.scheduler = intervalMs > 0
                ? new VerificationScheduler(orchestrator, Duration.ofMillis(intervalMs))
                : null;

        registerMetrics();

        log.info("VerifierFactory initialized: providers={}, models={}, channels={}",
                providerRegistry.size(), providerRegistry.getAllModels().size(),
                dispatcher != null ? dispatcher.getChannels().size() : 0);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static VerifierFactory create(String configPath) {
        log.info("Initializing VerifierFactory from config: {}", configPath);
        return new VerifierFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from an already loaded configuration.
     */
    public static VerifierFactory create(VerifierConfig config) {
        return new VerifierFactory(config, null);
    }

    /**
     * Starts the caches, the notification queue and the scheduler.
     */
    public VerifierFactory start() {
        verificationCache.start();
        probeCache.start();
        if (dispatcher != null) {
            dispatcher.start();
            notificationSubscription = dispatcher.subscribeTo(eventBus,
                    parseEventTypes(config.getNotifications().getEventTypes()));
        }
        if (scheduler != null) {
            scheduler.start();
        }
        log.info("Verifier started");
        return this;
    }

    public VerifierConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public AdapterRegistry getAdapterRegistry() {
        return adapterRegistry;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public ProbeClient getProbeClient() {
        return probeClient;
    }

    public MultiLevelCache<VerificationResult> getVerificationCache() {
        return verificationCache;
    }

    public MultiLevelCache<ProbeResult> getProbeCache() {
        return probeCache;
    }

    public VerificationStore getStore() {
        return store;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public VerificationOrchestrator getOrchestrator() {
        return orchestrator;
    }

    /**
     * @return the dispatcher, or null when notifications are disabled
     */
    public NotificationDispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * @return the scheduler, or null when periodic re-verification is off
     */
    public VerificationScheduler getScheduler() {
        return scheduler;
    }

    private void loadProviders() {
        for (VerifierConfig.ProviderConfig providerConfig : config.getProviders()) {
            if (!providerConfig.isEnabled()) {
                log.info("Skipping disabled provider: {}", providerConfig.getName());
                continue;
            }
            String adapter = providerConfig.getAdapter() != null ? providerConfig.getAdapter() : providerConfig.getName();
            Provider provider = new Provider(
                    providerConfig.getName(),
                    URI.create(providerConfig.getBaseUrl()),
                    providerConfig.getCredential(),
                    adapter
            );
            providerRegistry.registerProvider(provider);
            log.debug("Registered provider: {}", provider.name());
        }

        for (VerifierConfig.ModelConfig modelConfig : config.getModels()) {
            if (providerRegistry.getProvider(modelConfig.getProvider()).isEmpty()) {
                log.warn("Skipping model of unknown or disabled provider: provider={}, model={}",
                        modelConfig.getProvider(), modelConfig.getId());
                continue;
            }
            providerRegistry.registerModel(
                    new Model(modelConfig.getId(), modelConfig.getProvider(), modelConfig.featureSet()));
        }
    }

    private <V> CacheTier<V> distributedTier(ObjectMapper mapper, Class<V> type, String namespace) {
        VerifierConfig.RedisConfig redis = config.getCache().getRedis();
        if (!config.getCache().isEnabled() || !redis.isEnabled()) {
            return CacheTier.none();
        }
        return RedisCacheTier.create(redis, mapper, type, namespace);
    }

    private NotificationDispatcher createDispatcher() {
        VerifierConfig.NotificationsConfig notifications = config.getNotifications();
        NotificationDispatcher.Builder builder = NotificationDispatcher.builder()
                .fromConfig(notifications.getQueue())
                .metrics(metricsRegistry);

        HttpClient webhookClient = null;
        if (notifications.getSlack().isEnabled()) {
            webhookClient = newWebhookClient();
            VerifierConfig.SlackConfig slack = notifications.getSlack();
            builder.channel(new SlackWebhookChannel(
                    URI.create(slack.getWebhookUrl()), slack.getChannel(), slack.getUsername(), webhookClient));
        }
        if (notifications.getTelegram().isEnabled()) {
            if (webhookClient == null) {
                webhookClient = newWebhookClient();
            }
            VerifierConfig.TelegramConfig telegram = notifications.getTelegram();
            builder.channel(new TelegramChannel(
                    telegram.getApiBaseUrl(), telegram.getBotToken(), telegram.getChatId(), webhookClient));
        }
        if (notifications.getEmail().isEnabled()) {
            builder.channel(new EmailChannel(notifications.getEmail()));
        }
        return builder.build();
    }

    private static HttpClient newWebhookClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Maps configured names to event types; accepts both {@code score.changed} and {@code SCORE_CHANGED}.
     * An empty list means every type.
     */
    static Set<EventType> parseEventTypes(List<String> names) {
        Set<EventType> types = EnumSet.noneOf(EventType.class);
        if (names == null) {
            return types;
        }
        for (String name : names) {
            EventType match = null;
            for (EventType type : EventType.values()) {
                if (type.getWireName().equalsIgnoreCase(name) || type.name().equals(name.toUpperCase(Locale.ROOT))) {
                    match = type;
                    break;
                }
            }
            if (match == null) {
                throw new ConfigLoader.ConfigurationException("Unknown notification event type: " + name);
            }
            types.add(match);
        }
        return types;
    }

    private void registerMetrics() {
        if (metricsRegistry == null) {
            return;
        }
        metricsRegistry.registerGauge("cache.verification.hit_rate", "Verification cache hit rate (percent)",
                () -> verificationCache.stats().hitRate());
        metricsRegistry.registerGauge("cache.verification.items", "Verification cache entries",
                () -> verificationCache.stats().totalItems());
        metricsRegistry.registerGauge("cache.probe.hit_rate", "Probe cache hit rate (percent)",
                () -> probeCache.stats().hitRate());
        metricsRegistry.registerGauge("verifications.in_flight", "Verifications currently running",
                orchestrator::getInFlightCount);
        if (dispatcher != null) {
            metricsRegistry.registerGauge("notifications.queue.remaining", "Free notification queue slots",
                    dispatcher::getRemainingCapacity);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down VerifierFactory...");

        if (scheduler != null) {
            try {
                scheduler.close();
            } catch (Exception e) {
                log.warn("Error closing scheduler", e);
            }
        }

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        if (notificationSubscription != null) {
            notificationSubscription.cancel();
        }
        if (dispatcher != null) {
            try {
                dispatcher.close();
            } catch (Exception e) {
                log.warn("Error closing notification dispatcher", e);
            }
        }

        try {
            verificationCache.close();
            probeCache.close();
        } catch (Exception e) {
            log.warn("Error closing caches", e);
        }

        try {
            probeClient.close();
        } catch (Exception e) {
            log.warn("Error closing probe client", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("VerifierFactory shut down");
    }
}
