package fr.lapetina.llm.verifier.domain.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed registry of provider adapters.
 *
 * Thread-safe for concurrent registration and lookup. Lookups are case-insensitive
 * and a missing adapter is an ordinary {@link Optional#empty()}, not an error.
 */
public final class AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, ProviderAdapter> adapters = new ConcurrentHashMap<>();

    /**
     * Creates a registry holding the built-in adapters.
     */
    public static AdapterRegistry withDefaults() {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(new OpenAiAdapter());
        registry.register(new DeepSeekAdapter());
        return registry;
    }

    /**
     * Registers an adapter, replacing any previous adapter with the same name.
     */
    public void register(ProviderAdapter adapter) {
        Objects.requireNonNull(adapter, "Adapter is required");
        ProviderAdapter previous = adapters.put(normalize(adapter.name()), adapter);
        if (previous == null) {
            log.info("Adapter registered: name={}, batchSize={}", adapter.name(), adapter.optimalBatchSize());
        } else {
            log.info("Adapter replaced: name={}, batchSize={}", adapter.name(), adapter.optimalBatchSize());
        }
    }

    /**
     * Removes an adapter by name.
     */
    public Optional<ProviderAdapter> unregister(String name) {
        if (name == null) {
            return Optional.empty();
        }
        ProviderAdapter removed = adapters.remove(normalize(name));
        if (removed != null) {
            log.info("Adapter removed: name={}", removed.name());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<ProviderAdapter> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(normalize(name)));
    }

    /**
     * Sorted names of all registered adapters.
     */
    public List<String> availableProviders() {
        return adapters.values().stream()
                .map(ProviderAdapter::name)
                .sorted(String.CASE_INSENSITIVE_ORDER)
                .toList();
    }

    public int size() {
        return adapters.size();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
