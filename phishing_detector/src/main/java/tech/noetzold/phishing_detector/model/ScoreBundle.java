package tech.noetzold.phishing_detector.model;

import java.util.List;

/**
 * Raw per-request distances, before any bias is applied. Missing classes carry 1.0.
 */
public record ScoreBundle(
        double phishMin,
        double phishAvg,
        double legitMin,
        double legitAvg,
        List<ClusterScore> clusters,
        Integer bestCluster,
        boolean phishAvailable,
        boolean legitAvailable,
        int subjectSize
) {
    public static final double MAX_DISTANCE = 1.0;

    public ScoreBundle {
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
    }
}
