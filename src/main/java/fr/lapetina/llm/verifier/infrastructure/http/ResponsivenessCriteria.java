package fr.lapetina.llm.verifier.infrastructure.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Pass rule for the responsiveness probe.
 *
 * <p>A response passes when it completed inside the probe deadline, its first
 * content token arrived within {@code ttftCeiling} and the whole exchange took
 * no longer than {@code totalCeiling}. A missing TTFT (no content at all) fails.
 */
public record ResponsivenessCriteria(Duration ttftCeiling, Duration totalCeiling) {

    public static final ResponsivenessCriteria DEFAULT =
            new ResponsivenessCriteria(Duration.ofSeconds(10), Duration.ofSeconds(60));

    public ResponsivenessCriteria {
        Objects.requireNonNull(ttftCeiling, "TTFT ceiling is required");
        Objects.requireNonNull(totalCeiling, "Total ceiling is required");
        if (ttftCeiling.isNegative() || ttftCeiling.isZero() || totalCeiling.isNegative() || totalCeiling.isZero()) {
            throw new IllegalArgumentException("Ceilings must be positive");
        }
        if (ttftCeiling.compareTo(totalCeiling) > 0) {
            throw new IllegalArgumentException("TTFT ceiling must not exceed total ceiling");
        }
    }

    public Verdict evaluate(Duration total, Duration timeToFirstToken, boolean completedInTime) {
        if (!completedInTime) {
            return Verdict.fail("No complete response within the probe deadline");
        }
        if (timeToFirstToken == null) {
            return Verdict.fail("No content received");
        }
        if (timeToFirstToken.compareTo(ttftCeiling) > 0) {
            return Verdict.fail("Time to first token " + timeToFirstToken.toMillis()
                    + "ms exceeds " + ttftCeiling.toMillis() + "ms");
        }
        if (total.compareTo(totalCeiling) > 0) {
            return Verdict.fail("Total latency " + total.toMillis()
                    + "ms exceeds " + totalCeiling.toMillis() + "ms");
        }
        return Verdict.PASS;
    }

    public record Verdict(boolean passed, String reason) {
        static final Verdict PASS = new Verdict(true, null);

        static Verdict fail(String reason) {
            return new Verdict(false, reason);
        }
    }
}
