package fr.lapetina.llm.verifier.infrastructure.config;

import fr.lapetina.llm.verifier.domain.model.ModelFeature;
import fr.lapetina.llm.verifier.domain.scoring.ScoringWeights;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration object for the verifier.
 * Designed to be populated from YAML and read once at startup.
 *
 * <p>Sections expose typed {@code update*} methods for programmatic changes;
 * each validates its arguments and leaves the section untouched when they are invalid.
 */
public class VerifierConfig {

    private ProbeConfig probe = new ProbeConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private List<ModelConfig> models = new ArrayList<>();
    private ConcurrencyConfig concurrency = new ConcurrencyConfig();
    private CacheConfig cache = new CacheConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private NotificationsConfig notifications = new NotificationsConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ProbeConfig getProbe() { return probe; }
    public void setProbe(ProbeConfig probe) { this.probe = probe; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    public ConcurrencyConfig getConcurrency() { return concurrency; }
    public void setConcurrency(ConcurrencyConfig concurrency) { this.concurrency = concurrency; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public ScoringConfig getScoring() { return scoring; }
    public void setScoring(ScoringConfig scoring) { this.scoring = scoring; }

    public NotificationsConfig getNotifications() { return notifications; }
    public void setNotifications(NotificationsConfig notifications) { this.notifications = notifications; }

    public SchedulerConfig getScheduler() { return scheduler; }
    public void setScheduler(SchedulerConfig scheduler) { this.scheduler = scheduler; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Validates every section.
     *
     * @throws IllegalArgumentException describing the first invalid field
     */
    public void validate() {
        probe.validate();
        concurrency.validate();
        cache.validate();
        scoring.toWeights();
        notifications.validate();
        if (scheduler.getIntervalMs() < 0) {
            throw new IllegalArgumentException("scheduler.intervalMs must not be negative");
        }

        Set<String> providerNames = new HashSet<>();
        for (ProviderConfig provider : providers) {
            provider.validate();
            if (!providerNames.add(provider.getName().toLowerCase())) {
                throw new IllegalArgumentException("Duplicate provider: " + provider.getName());
            }
        }
        for (ModelConfig model : models) {
            model.validate();
            if (!providerNames.contains(model.getProvider().toLowerCase())) {
                throw new IllegalArgumentException(
                        "Model " + model.getId() + " references unknown provider: " + model.getProvider());
            }
        }
    }

    private static void requirePositive(long value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive, got " + value);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    /**
     * Probe timeouts, ceilings and feature selection.
     */
    public static class ProbeConfig {
        private long requestTimeoutMs = 90000;
        private long connectTimeoutMs = 10000;
        private long ttftCeilingMs = 10000;
        private long totalCeilingMs = 60000;
        private int expectedEmbeddingDimensions = 0;
        private List<String> defaultFeatures = new ArrayList<>(List.of("function-calling"));

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getTtftCeilingMs() { return ttftCeilingMs; }
        public void setTtftCeilingMs(long ttftCeilingMs) { this.ttftCeilingMs = ttftCeilingMs; }

        public long getTotalCeilingMs() { return totalCeilingMs; }
        public void setTotalCeilingMs(long totalCeilingMs) { this.totalCeilingMs = totalCeilingMs; }

        public int getExpectedEmbeddingDimensions() { return expectedEmbeddingDimensions; }
        public void setExpectedEmbeddingDimensions(int expectedEmbeddingDimensions) { this.expectedEmbeddingDimensions = expectedEmbeddingDimensions; }

        public List<String> getDefaultFeatures() { return defaultFeatures; }
        public void setDefaultFeatures(List<String> defaultFeatures) { this.defaultFeatures = defaultFeatures; }

        public Duration requestTimeout() { return Duration.ofMillis(requestTimeoutMs); }
        public Duration ttftCeiling() { return Duration.ofMillis(ttftCeilingMs); }
        public Duration totalCeiling() { return Duration.ofMillis(totalCeilingMs); }

        public Set<ModelFeature> defaultFeatureSet() {
            Set<ModelFeature> features = new HashSet<>();
            for (String name : defaultFeatures) {
                features.add(ModelFeature.fromName(name));
            }
            return features;
        }

        public void updateTimeouts(long requestTimeoutMs, long connectTimeoutMs) {
            requirePositive(requestTimeoutMs, "probe.requestTimeoutMs");
            requirePositive(connectTimeoutMs, "probe.connectTimeoutMs");
            this.requestTimeoutMs = requestTimeoutMs;
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public void updateCeilings(long ttftCeilingMs, long totalCeilingMs) {
            requirePositive(ttftCeilingMs, "probe.ttftCeilingMs");
            requirePositive(totalCeilingMs, "probe.totalCeilingMs");
            if (ttftCeilingMs > totalCeilingMs) {
                throw new IllegalArgumentException("probe.ttftCeilingMs must not exceed probe.totalCeilingMs");
            }
            this.ttftCeilingMs = ttftCeilingMs;
            this.totalCeilingMs = totalCeilingMs;
        }

        public void updateDefaultFeatures(List<String> features) {
            for (String name : features) {
                ModelFeature.fromName(name);
            }
            this.defaultFeatures = new ArrayList<>(features);
        }

        void validate() {
            requirePositive(requestTimeoutMs, "probe.requestTimeoutMs");
            requirePositive(connectTimeoutMs, "probe.connectTimeoutMs");
            requirePositive(ttftCeilingMs, "probe.ttftCeilingMs");
            requirePositive(totalCeilingMs, "probe.totalCeilingMs");
            if (expectedEmbeddingDimensions < 0) {
                throw new IllegalArgumentException("probe.expectedEmbeddingDimensions must not be negative");
            }
            defaultFeatureSet();
        }
    }

    /**
     * One provider endpoint.
     */
    public static class ProviderConfig {
        private String name;
        private String baseUrl;
        private String credential;
        private String adapter;
        private boolean enabled = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getCredential() { return credential; }
        public void setCredential(String credential) { this.credential = credential; }

        public String getAdapter() { return adapter; }
        public void setAdapter(String adapter) { this.adapter = adapter; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        void validate() {
            requireText(name, "providers[].name");
            requireText(baseUrl, "providers[" + name + "].baseUrl");
            if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
                throw new IllegalArgumentException("providers[" + name + "].baseUrl must be http(s): " + baseUrl);
            }
        }
    }

    /**
     * One model to verify.
     */
    public static class ModelConfig {
        private String provider;
        private String id;
        private List<String> features = new ArrayList<>();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public List<String> getFeatures() { return features; }
        public void setFeatures(List<String> features) { this.features = features; }

        public Set<ModelFeature> featureSet() {
            Set<ModelFeature> set = new HashSet<>();
            if (features != null) {
                for (String name : features) {
                    set.add(ModelFeature.fromName(name));
                }
            }
            return set;
        }

        void validate() {
            requireText(provider, "models[].provider");
            requireText(id, "models[].id");
            featureSet();
        }
    }

    /**
     * Probe worker pool and circuit breaker settings.
     */
    public static class ConcurrencyConfig {
        private int workerThreads = 16;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int circuitBreakerFailureThreshold) { this.circuitBreakerFailureThreshold = circuitBreakerFailureThreshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long circuitBreakerRecoveryMs) { this.circuitBreakerRecoveryMs = circuitBreakerRecoveryMs; }

        public void updateCircuitBreaker(int failureThreshold, long recoveryMs) {
            if (failureThreshold < 0) {
                throw new IllegalArgumentException("concurrency.circuitBreakerFailureThreshold must not be negative");
            }
            requirePositive(recoveryMs, "concurrency.circuitBreakerRecoveryMs");
            this.circuitBreakerFailureThreshold = failureThreshold;
            this.circuitBreakerRecoveryMs = recoveryMs;
        }

        void validate() {
            requirePositive(workerThreads, "concurrency.workerThreads");
            if (circuitBreakerFailureThreshold < 0) {
                throw new IllegalArgumentException("concurrency.circuitBreakerFailureThreshold must not be negative");
            }
            requirePositive(circuitBreakerRecoveryMs, "concurrency.circuitBreakerRecoveryMs");
        }
    }

    /**
     * Multi-level cache configuration.
     */
    public static class CacheConfig {
        private boolean enabled = true;
        private long defaultTtlMs = 3600000;
        private long cleanupIntervalMs = 60000;
        private RedisConfig redis = new RedisConfig();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getDefaultTtlMs() { return defaultTtlMs; }
        public void setDefaultTtlMs(long defaultTtlMs) { this.defaultTtlMs = defaultTtlMs; }

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }

        public RedisConfig getRedis() { return redis; }
        public void setRedis(RedisConfig redis) { this.redis = redis; }

        public Duration defaultTtl() { return Duration.ofMillis(defaultTtlMs); }

        public void updateTtl(long defaultTtlMs) {
            requirePositive(defaultTtlMs, "cache.defaultTtlMs");
            this.defaultTtlMs = defaultTtlMs;
        }

        public void updateCleanupInterval(long cleanupIntervalMs) {
            requirePositive(cleanupIntervalMs, "cache.cleanupIntervalMs");
            this.cleanupIntervalMs = cleanupIntervalMs;
        }

        void validate() {
            requirePositive(defaultTtlMs, "cache.defaultTtlMs");
            requirePositive(cleanupIntervalMs, "cache.cleanupIntervalMs");
            redis.validate();
        }
    }

    /**
     * Optional distributed cache tier. Disabled means no distributed tier at all.
     */
    public static class RedisConfig {
        private boolean enabled = false;
        private String host = "localhost";
        private int port = 6379;
        private String password;
        private int database = 0;
        private int timeoutMs = 2000;
        private String keyPrefix = "llm-verifier:";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public int getDatabase() { return database; }
        public void setDatabase(int database) { this.database = database; }

        public int getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }

        void validate() {
            if (!enabled) {
                return;
            }
            requireText(host, "cache.redis.host");
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("cache.redis.port out of range: " + port);
            }
            requirePositive(timeoutMs, "cache.redis.timeoutMs");
        }
    }

    /**
     * Score component weights; must sum to 100.
     */
    public static class ScoringConfig {
        private int existenceWeight = 20;
        private int responsivenessWeight = 25;
        private int featuresWeight = 30;
        private int latencyWeight = 15;
        private int transportWeight = 10;
        private long fastLatencyMs = 100;
        private long slowLatencyMs = 500;

        public int getExistenceWeight() { return existenceWeight; }
        public void setExistenceWeight(int existenceWeight) { this.existenceWeight = existenceWeight; }

        public int getResponsivenessWeight() { return responsivenessWeight; }
        public void setResponsivenessWeight(int responsivenessWeight) { this.responsivenessWeight = responsivenessWeight; }

        public int getFeaturesWeight() { return featuresWeight; }
        public void setFeaturesWeight(int featuresWeight) { this.featuresWeight = featuresWeight; }

        public int getLatencyWeight() { return latencyWeight; }
        public void setLatencyWeight(int latencyWeight) { this.latencyWeight = latencyWeight; }

        public int getTransportWeight() { return transportWeight; }
        public void setTransportWeight(int transportWeight) { this.transportWeight = transportWeight; }

        public long getFastLatencyMs() { return fastLatencyMs; }
        public void setFastLatencyMs(long fastLatencyMs) { this.fastLatencyMs = fastLatencyMs; }

        public long getSlowLatencyMs() { return slowLatencyMs; }
        public void setSlowLatencyMs(long slowLatencyMs) { this.slowLatencyMs = slowLatencyMs; }

        public ScoringWeights toWeights() {
            return new ScoringWeights(existenceWeight, responsivenessWeight, featuresWeight,
                    latencyWeight, transportWeight,
                    Duration.ofMillis(fastLatencyMs), Duration.ofMillis(slowLatencyMs));
        }

        public void updateWeights(ScoringWeights weights) {
            this.existenceWeight = weights.existence();
            this.responsivenessWeight = weights.responsiveness();
            this.featuresWeight = weights.features();
            this.latencyWeight = weights.latency();
            this.transportWeight = weights.transportOptimization();
            this.fastLatencyMs = weights.fastLatency().toMillis();
            this.slowLatencyMs = weights.slowLatency().toMillis();
        }
    }

    /**
     * Notification queue and channel settings.
     */
    public static class NotificationsConfig {
        private boolean enabled = true;
        private List<String> eventTypes = new ArrayList<>();
        private QueueConfig queue = new QueueConfig();
        private SlackConfig slack = new SlackConfig();
        private TelegramConfig telegram = new TelegramConfig();
        private EmailConfig email = new EmailConfig();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<String> getEventTypes() { return eventTypes; }
        public void setEventTypes(List<String> eventTypes) { this.eventTypes = eventTypes; }

        public QueueConfig getQueue() { return queue; }
        public void setQueue(QueueConfig queue) { this.queue = queue; }

        public SlackConfig getSlack() { return slack; }
        public void setSlack(SlackConfig slack) { this.slack = slack; }

        public TelegramConfig getTelegram() { return telegram; }
        public void setTelegram(TelegramConfig telegram) { this.telegram = telegram; }

        public EmailConfig getEmail() { return email; }
        public void setEmail(EmailConfig email) { this.email = email; }

        void validate() {
            queue.validate();
            if (slack.isEnabled()) {
                requireText(slack.getWebhookUrl(), "notifications.slack.webhookUrl");
            }
            if (telegram.isEnabled()) {
                requireText(telegram.getBotToken(), "notifications.telegram.botToken");
                requireText(telegram.getChatId(), "notifications.telegram.chatId");
            }
            if (email.isEnabled()) {
                requireText(email.getSmtpHost(), "notifications.email.smtpHost");
                requireText(email.getFrom(), "notifications.email.from");
                requireText(email.getTo(), "notifications.email.to");
            }
        }
    }

    /**
     * Dispatcher ring buffer and worker pool.
     */
    public static class QueueConfig {
        private int capacity = 1024;
        private int workers = 4;
        private long sendTimeoutMs = 5000;
        private long shutdownGraceMs = 10000;
        private String waitStrategy = "blocking";

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public long getSendTimeoutMs() { return sendTimeoutMs; }
        public void setSendTimeoutMs(long sendTimeoutMs) { this.sendTimeoutMs = sendTimeoutMs; }

        public long getShutdownGraceMs() { return shutdownGraceMs; }
        public void setShutdownGraceMs(long shutdownGraceMs) { this.shutdownGraceMs = shutdownGraceMs; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public void updateQueue(int capacity, int workers, long sendTimeoutMs) {
            validateValues(capacity, workers, sendTimeoutMs, shutdownGraceMs);
            this.capacity = capacity;
            this.workers = workers;
            this.sendTimeoutMs = sendTimeoutMs;
        }

        void validate() {
            validateValues(capacity, workers, sendTimeoutMs, shutdownGraceMs);
        }

        private static void validateValues(int capacity, int workers, long sendTimeoutMs, long graceMs) {
            if (capacity <= 0 || Integer.bitCount(capacity) != 1) {
                throw new IllegalArgumentException("notifications.queue.capacity must be a power of 2: " + capacity);
            }
            requirePositive(workers, "notifications.queue.workers");
            requirePositive(sendTimeoutMs, "notifications.queue.sendTimeoutMs");
            requirePositive(graceMs, "notifications.queue.shutdownGraceMs");
        }
    }

    /**
     * Chat webhook channel.
     */
    public static class SlackConfig {
        private boolean enabled = false;
        private String webhookUrl;
        private String channel;
        private String username = "llm-verifier";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getWebhookUrl() { return webhookUrl; }
        public void setWebhookUrl(String webhookUrl) { this.webhookUrl = webhookUrl; }

        public String getChannel() { return channel; }
        public void setChannel(String channel) { this.channel = channel; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
    }

    /**
     * Bot API channel.
     */
    public static class TelegramConfig {
        private boolean enabled = false;
        private String botToken;
        private String chatId;
        private String apiBaseUrl = "https://api.telegram.org";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBotToken() { return botToken; }
        public void setBotToken(String botToken) { this.botToken = botToken; }

        public String getChatId() { return chatId; }
        public void setChatId(String chatId) { this.chatId = chatId; }

        public String getApiBaseUrl() { return apiBaseUrl; }
        public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }
    }

    /**
     * SMTP channel.
     */
    public static class EmailConfig {
        private boolean enabled = false;
        private String smtpHost;
        private int smtpPort = 587;
        private String username;
        private String password;
        private String from;
        private String to;
        private boolean startTls = true;
        private int timeoutMs = 10000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getSmtpHost() { return smtpHost; }
        public void setSmtpHost(String smtpHost) { this.smtpHost = smtpHost; }

        public int getSmtpPort() { return smtpPort; }
        public void setSmtpPort(int smtpPort) { this.smtpPort = smtpPort; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getFrom() { return from; }
        public void setFrom(String from) { this.from = from; }

        public String getTo() { return to; }
        public void setTo(String to) { this.to = to; }

        public boolean isStartTls() { return startTls; }
        public void setStartTls(boolean startTls) { this.startTls = startTls; }

        public int getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    /**
     * Periodic re-verification of configured models; 0 disables it.
     */
    public static class SchedulerConfig {
        private long intervalMs = 0;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_verifier";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
