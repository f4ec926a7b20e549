package fr.lapetina.llm.verifier.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.UnaryOperator;

/**
 * Resolves provider credential references.
 * {@code env:NAME} reads an environment variable; any other value is used as is.
 */
public final class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);
    private static final String ENV_PREFIX = "env:";

    private final UnaryOperator<String> environment;

    public CredentialResolver(UnaryOperator<String> environment) {
        this.environment = environment;
    }

    public CredentialResolver() {
        this(System::getenv);
    }

    /**
     * @return the credential, or an empty string when the reference is absent or unresolved
     */
    public String resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return "";
        }
        if (!reference.startsWith(ENV_PREFIX)) {
            return reference;
        }
        String variable = reference.substring(ENV_PREFIX.length()).trim();
        String value = environment.apply(variable);
        if (value == null || value.isBlank()) {
            log.warn("Credential environment variable not set: variable={}", variable);
            return "";
        }
        return value;
    }
}
