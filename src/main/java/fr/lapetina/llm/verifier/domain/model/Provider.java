package fr.lapetina.llm.verifier.domain.model;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * An LLM provider endpoint. Immutable once registered.
 *
 * @param name          provider identity, matched case-insensitively
 * @param baseUrl       API base, e.g. {@code https://api.openai.com/v1}
 * @param credentialRef reference resolved at probe time (literal or {@code env:NAME})
 * @param adapterName   name of the {@code ProviderAdapter} handling this provider
 */
public record Provider(
        String name,
        URI baseUrl,
        String credentialRef,
        String adapterName
) {
    public Provider {
        Objects.requireNonNull(name, "Provider name is required");
        Objects.requireNonNull(baseUrl, "Base URL is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        if (adapterName == null || adapterName.isBlank()) {
            adapterName = name;
        }
    }

    public static Provider of(String name, String baseUrl, String credentialRef) {
        return new Provider(name, URI.create(baseUrl), credentialRef, name);
    }

    /**
     * Lower-cased name used as lookup and cache key.
     */
    public String key() {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a path against the base URL, tolerating a trailing slash on either side.
     */
    public URI endpoint(String path) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String suffix = path.startsWith("/") ? path : "/" + path;
        return URI.create(base + suffix);
    }

    @Override
    public String toString() {
        return "Provider{name='" + name + "', baseUrl=" + baseUrl + ", adapter='" + adapterName + "'}";
    }
}
