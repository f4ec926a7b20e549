package fr.lapetina.llm.verifier.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one probe. Immutable once produced.
 */
public record ProbeResult(
        ProbeKind kind,
        boolean passed,
        Integer httpStatus,
        Duration latency,
        Duration timeToFirstToken,
        TaxonomyError error,
        String evidence,
        boolean transportOptimized,
        RateLimitInfo rateLimit,
        Instant completedAt
) {
    public static final int MAX_EVIDENCE_LENGTH = 512;

    public ProbeResult {
        Objects.requireNonNull(kind, "Probe kind is required");
        if (latency == null) {
            latency = Duration.ZERO;
        }
        if (completedAt == null) {
            completedAt = Instant.now();
        }
        evidence = truncate(evidence);
        if (passed && error != null) {
            throw new IllegalArgumentException("A passed probe cannot carry an error");
        }
    }

    public static ProbeResult failed(ProbeKind kind, TaxonomyError error) {
        return builder(kind).error(error).build();
    }

    public static String truncate(String evidence) {
        if (evidence == null || evidence.length() <= MAX_EVIDENCE_LENGTH) {
            return evidence;
        }
        return evidence.substring(0, MAX_EVIDENCE_LENGTH);
    }

    public static Builder builder(ProbeKind kind) {
        return new Builder(kind);
    }

    public static final class Builder {
        private final ProbeKind kind;
        private boolean passed;
        private Integer httpStatus;
        private Duration latency;
        private Duration timeToFirstToken;
        private TaxonomyError error;
        private String evidence;
        private boolean transportOptimized;
        private RateLimitInfo rateLimit;
        private Instant completedAt;

        private Builder(ProbeKind kind) {
            this.kind = kind;
        }

        public Builder passed(boolean passed) {
            this.passed = passed;
            return this;
        }

        public Builder httpStatus(Integer httpStatus) {
            this.httpStatus = httpStatus;
            return this;
        }

        public Builder latency(Duration latency) {
            this.latency = latency;
            return this;
        }

        public Builder timeToFirstToken(Duration timeToFirstToken) {
            this.timeToFirstToken = timeToFirstToken;
            return this;
        }

        public Builder error(TaxonomyError error) {
            this.error = error;
            if (error != null) {
                this.passed = false;
            }
            return this;
        }

        public Builder evidence(String evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder transportOptimized(boolean transportOptimized) {
            this.transportOptimized = transportOptimized;
            return this;
        }

        public Builder rateLimit(RateLimitInfo rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public ProbeResult build() {
            return new ProbeResult(kind, passed, httpStatus, latency, timeToFirstToken, error,
                    evidence, transportOptimized, rateLimit, completedAt);
        }
    }
}
