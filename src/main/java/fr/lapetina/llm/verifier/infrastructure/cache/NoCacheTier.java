package fr.lapetina.llm.verifier.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

final class NoCacheTier implements CacheTier<Object> {

    static final NoCacheTier INSTANCE = new NoCacheTier();

    private NoCacheTier() {
    }

    @Override
    public String name() {
        return "none";
    }

    @Override
    public Optional<Object> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        CacheTier.requirePositiveTtl(ttl);
    }

    @Override
    public void delete(String key) {
    }

    @Override
    public void clear() {
    }

    @Override
    public boolean isPresent() {
        return false;
    }
}
