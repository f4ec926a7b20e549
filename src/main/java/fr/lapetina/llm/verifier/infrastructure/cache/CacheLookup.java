package fr.lapetina.llm.verifier.infrastructure.cache;

import java.util.Optional;

/**
 * Result of a cache read: the value and whether it was a hit.
 */
public record CacheLookup<V>(V value, boolean hit) {

    public static <V> CacheLookup<V> hit(V value) {
        return new CacheLookup<>(value, true);
    }

    public static <V> CacheLookup<V> miss() {
        return new CacheLookup<>(null, false);
    }

    public Optional<V> asOptional() {
        return hit ? Optional.ofNullable(value) : Optional.empty();
    }
}
