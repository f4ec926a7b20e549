package fr.lapetina.llm.verifier.infrastructure.provider;

import fr.lapetina.llm.verifier.domain.model.Model;
import fr.lapetina.llm.verifier.domain.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of providers and the models known for each.
 *
 * Thread-safe. Providers are immutable and looked up case-insensitively;
 * re-registering a name replaces the provider and keeps its models.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, Provider> providers = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Model>> models = new ConcurrentHashMap<>();
    private final List<Consumer<ProviderRegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new provider or replaces an existing one.
     */
    public void registerProvider(Provider provider) {
        Provider previous = providers.put(provider.key(), provider);
        if (previous == null) {
            log.info("Provider registered: {}", provider);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.ADDED, provider, null));
        } else {
            log.info("Provider updated: {}", provider);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.UPDATED, provider, null));
        }
    }

    /**
     * Removes a provider and its models.
     */
    public Optional<Provider> removeProvider(String name) {
        String key = normalize(name);
        Provider removed = providers.remove(key);
        models.remove(key);
        if (removed != null) {
            log.info("Provider removed: {}", removed);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.REMOVED, removed, null));
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Provider> getProvider(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(normalize(name)));
    }

    public List<Provider> getAllProviders() {
        return new ArrayList<>(providers.values());
    }

    /**
     * Adds a model to its provider's catalogue.
     *
     * @throws IllegalArgumentException if the provider is not registered
     */
    public void registerModel(Model model) {
        Provider provider = getProvider(model.provider())
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + model.provider()));
        models.computeIfAbsent(provider.key(), k -> new ConcurrentHashMap<>()).put(model.id(), model);
        log.debug("Model registered: provider={}, model={}, features={}",
                provider.name(), model.id(), model.features());
        notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.MODEL_ADDED, provider, model));
    }

    public Optional<Model> getModel(String provider, String modelId) {
        Map<String, Model> catalogue = models.get(normalize(provider));
        return catalogue == null ? Optional.empty() : Optional.ofNullable(catalogue.get(modelId));
    }

    public List<Model> getModels(String provider) {
        Map<String, Model> catalogue = models.get(normalize(provider));
        return catalogue == null ? List.of() : new ArrayList<>(catalogue.values());
    }

    public List<Model> getAllModels() {
        List<Model> all = new ArrayList<>();
        models.values().forEach(catalogue -> all.addAll(catalogue.values()));
        return all;
    }

    public void addListener(Consumer<ProviderRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ProviderRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ProviderRegistryEvent event) {
        for (Consumer<ProviderRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    public int size() {
        return providers.size();
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Event for registry changes; {@code model} is set only for {@code MODEL_ADDED}.
     */
    public record ProviderRegistryEvent(Type type, Provider provider, Model model) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED,
            MODEL_ADDED
        }
    }
}
