package fr.lapetina.llm.verifier.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A model offered by a provider, with the features it declares.
 * Read-only to the engine.
 */
public record Model(
        String id,
        String provider,
        Set<ModelFeature> features
) {
    public Model {
        Objects.requireNonNull(id, "Model id is required");
        Objects.requireNonNull(provider, "Provider is required");
        features = features == null || features.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(features));
    }

    public static Model of(String provider, String id) {
        return new Model(id, provider, Set.of());
    }

    public boolean supports(ModelFeature feature) {
        return features.contains(feature);
    }
}
