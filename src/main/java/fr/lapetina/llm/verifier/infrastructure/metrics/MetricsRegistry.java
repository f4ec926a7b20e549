package fr.lapetina.llm.verifier.infrastructure.metrics;

import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.domain.model.ProbeKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Probe latency timers per provider and probe kind
 * - Probe outcome and error counters
 * - Verification score distribution
 * - Cache and notification gauges/counters
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> probeTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> probeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> scoreSummaries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("llm_verifier");
    }

    /**
     * Records the latency and outcome of one probe.
     */
    public void recordProbe(String provider, ProbeKind kind, Duration latency, boolean passed) {
        String timerKey = provider + ":" + kind.name();
        probeTimers.computeIfAbsent(timerKey, k ->
                Timer.builder(prefix + "_probe_latency")
                        .description("Probe latency")
                        .tag("provider", provider)
                        .tag("kind", kind.tag())
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);

        String outcome = passed ? "passed" : "failed";
        probeCounters.computeIfAbsent(timerKey + ":" + outcome, k ->
                Counter.builder(prefix + "_probes_total")
                        .description("Total number of probes")
                        .tag("provider", provider)
                        .tag("kind", kind.tag())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the error counter for a classified probe failure.
     */
    public void incrementErrorCount(String provider, ErrorType errorType) {
        String key = provider + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of classified errors")
                        .tag("provider", provider)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records a verification score.
     */
    public void recordScore(String provider, int score) {
        scoreSummaries.computeIfAbsent(provider, k ->
                DistributionSummary.builder(prefix + "_verification_score")
                        .description("Verification scores")
                        .tag("provider", provider)
                        .register(registry)
        ).record(score);
    }

    /**
     * Counts a notification delivery attempt.
     */
    public void recordDelivery(String channel, boolean success) {
        String outcome = success ? "delivered" : "failed";
        deliveryCounters.computeIfAbsent(channel + ":" + outcome, k ->
                Counter.builder(prefix + "_notifications_total")
                        .description("Notification delivery attempts")
                        .tag("channel", channel)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge backed by a supplier, e.g. cache hit rate or queue capacity.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    /**
     * Returns Prometheus-formatted metrics.
     */
    public String scrape() {
        return registry.scrape();
    }

    public PrometheusMeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
        log.info("MetricsRegistry closed");
    }
}
