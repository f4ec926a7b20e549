package fr.lapetina.llm.verifier.infrastructure.cache;

import fr.lapetina.llm.verifier.domain.model.ProbeKind;

import java.util.Locale;

/**
 * Cache key layout: {@code provider:model:kind}.
 */
public final class CacheKeys {

    private static final String VERIFICATION = "verification";

    private CacheKeys() {
    }

    public static String probe(String provider, String model, ProbeKind kind) {
        return provider.toLowerCase(Locale.ROOT) + ":" + model + ":" + kind.tag();
    }

    public static String verification(String provider, String model) {
        return provider.toLowerCase(Locale.ROOT) + ":" + model + ":" + VERIFICATION;
    }
}
