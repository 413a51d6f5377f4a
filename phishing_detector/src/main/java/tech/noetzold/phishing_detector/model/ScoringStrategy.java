package tech.noetzold.phishing_detector.model;

public enum ScoringStrategy {
    FLAT,
    CLUSTERED;

    public static ScoringStrategy fromConfig(String value) {
        if (value == null || value.isBlank()) return CLUSTERED;
        return switch (value.trim().toLowerCase()) {
            case "flat", "prototype", "legacy" -> FLAT;
            case "clustered", "ncd-clustered" -> CLUSTERED;
            default -> throw new IllegalArgumentException("Unknown scoring strategy: " + value);
        };
    }

    public DecisionSource source() {
        return this == FLAT ? DecisionSource.PROTOTYPE : DecisionSource.NCD_CLUSTERED;
    }
}
