package tech.noetzold.phishing_detector.model;

/**
 * Output of an external classifier. {@code probability} belongs to the chosen {@code label}.
 */
public record MlPrediction(
        Label label,
        double probability
) {}
