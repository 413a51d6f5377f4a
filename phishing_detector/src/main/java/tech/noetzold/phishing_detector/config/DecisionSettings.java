package tech.noetzold.phishing_detector.config;

public record DecisionSettings(
        int minimalDomThreshold,
        double minimalDomPenalty,
        double highSeparation,
        double lowSeparation,
        double mlConfidenceThreshold,
        int smallDomThreshold
) {
    public DecisionSettings {
        if (minimalDomThreshold < 0 || smallDomThreshold < 0) {
            throw new IllegalArgumentException("size thresholds must not be negative");
        }
        if (minimalDomPenalty < 0) {
            throw new IllegalArgumentException("minimal DOM penalty must not be negative");
        }
        if (lowSeparation < 0 || highSeparation < lowSeparation) {
            throw new IllegalArgumentException("separation cutoffs must satisfy 0 <= low <= high");
        }
        if (mlConfidenceThreshold < 0 || mlConfidenceThreshold > 1) {
            throw new IllegalArgumentException("ml confidence threshold must be within [0, 1]");
        }
    }

    public static DecisionSettings defaults() {
        return new DecisionSettings(300, 0.05, 0.10, 0.05, 0.6, 2000);
    }
}
