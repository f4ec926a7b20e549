package fr.lapetina.llm.verifier.domain.model;

import java.util.Objects;

/**
 * A classified failure. {@code httpStatus} is null for transport and parse failures,
 * {@code providerType} is the provider's own error type when its body could be parsed.
 */
public record TaxonomyError(
        ErrorType type,
        Integer httpStatus,
        String message,
        String providerType
) {
    public TaxonomyError {
        Objects.requireNonNull(type, "Error type is required");
        if (message == null) {
            message = type.name();
        }
    }

    public static TaxonomyError of(ErrorType type, Integer httpStatus, String message) {
        return new TaxonomyError(type, httpStatus, message, null);
    }

    public static TaxonomyError transport(String message) {
        return new TaxonomyError(ErrorType.TRANSPORT_ERROR, null, message, null);
    }

    public static TaxonomyError parse(String message) {
        return new TaxonomyError(ErrorType.PARSE_ERROR, null, message, null);
    }
}
