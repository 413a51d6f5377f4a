package tech.noetzold.phishing_detector.clustering;

public enum SeedPolicy {
    RANDOM,
    // most atypical sample: largest mean distance to the rest
    HIGHEST_AVERAGE_DISTANCE
}
