package fr.lapetina.llm.verifier.domain.model;

/**
 * Error taxonomy for probes and notifications.
 * Every probe-level failure is reported as one of these, never as an exception.
 */
public enum ErrorType {
    /** Credential rejected by the provider (HTTP 401) */
    UNAUTHORIZED,

    /** Provider throttled the request (HTTP 429) */
    RATE_LIMITED,

    /** Provider-side failure (HTTP 5xx) */
    SERVER_ERROR,

    /** Model or endpoint does not exist (HTTP 404) */
    NOT_FOUND,

    /** Timeout, connection refused/reset, DNS failure or open circuit */
    TRANSPORT_ERROR,

    /** Malformed stream or JSON body */
    PARSE_ERROR,

    /** Notification queue stayed full for the whole bounded wait */
    QUEUE_FULL,

    /** Anything else; carries the provider's own error type/message or the raw body */
    UNCLASSIFIED
}
