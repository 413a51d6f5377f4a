package tech.noetzold.phishing_detector.model;

import java.util.List;

public record ClassificationResult(
        Verdict verdict,                 // final, after ML fusion
        Verdict ncd_verdict,
        double phish_min,
        double phish_avg,
        double legit_min,
        double legit_avg,
        double legit_min_adjusted,
        double legit_avg_adjusted,
        Integer best_cluster,
        List<ClusterScore> cluster_scores,
        int dom_size,
        boolean minimal_dom_adjustment_applied,
        Confidence confidence,
        String reason,
        DecisionSource source,           // policy behind ncd_verdict
        DecisionSource decision_source,  // policy behind verdict
        DetectionMode detection_mode,
        MlPrediction ml_prediction
) {
    public ClassificationResult {
        cluster_scores = cluster_scores == null ? List.of() : List.copyOf(cluster_scores);
    }
}
