package tech.noetzold.phishing_detector.config;

import java.nio.file.Path;

public record ClusteringSettings(
        Path samplesDir,
        Path outputDir,
        int prototypesPerClass,
        int maxClusters,
        int minClusters,
        double varianceEpsilon,
        boolean parallelMatrix
) {
    public ClusteringSettings {
        if (prototypesPerClass <= 0) {
            throw new IllegalArgumentException("prototypes per class must be positive");
        }
        if (minClusters <= 0 || maxClusters < minClusters) {
            throw new IllegalArgumentException("cluster bounds must satisfy 0 < min <= max");
        }
    }
}
