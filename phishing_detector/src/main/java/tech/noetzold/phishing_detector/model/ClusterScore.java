package tech.noetzold.phishing_detector.model;

public record ClusterScore(
        int cluster,
        double min,
        double avg,
        int prototypes
) {}
