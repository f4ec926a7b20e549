package fr.lapetina.llm.verifier.domain.model;

/**
 * Coding-capability category derived from the overall score.
 */
public enum CapabilityCategory {
    FULLY_CAPABLE("fully capable", 80),
    CAPABLE_WITH_TOOLING("capable with tooling", 60),
    CHAT_WITH_TOOLING("chat with tooling", 40),
    CHAT_ONLY("chat only", 0);

    private final String label;
    private final int minimumScore;

    CapabilityCategory(String label, int minimumScore) {
        this.label = label;
        this.minimumScore = minimumScore;
    }

    public String getLabel() {
        return label;
    }

    public int getMinimumScore() {
        return minimumScore;
    }

    public static CapabilityCategory forScore(int score) {
        for (CapabilityCategory category : values()) {
            if (score >= category.minimumScore) {
                return category;
            }
        }
        return CHAT_ONLY;
    }
}
