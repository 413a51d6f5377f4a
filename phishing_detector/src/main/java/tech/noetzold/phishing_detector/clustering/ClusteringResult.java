package tech.noetzold.phishing_detector.clustering;

import java.util.ArrayList;
import java.util.List;

/**
 * @param assignments cluster index (0-based, into {@code centers}) for every pool point
 * @param centers     pool indices of the selected centers, in selection order
 */
public record ClusteringResult(List<Integer> assignments, List<Integer> centers) {

    public ClusteringResult {
        assignments = List.copyOf(assignments);
        centers = List.copyOf(centers);
    }

    public int clusterCount() {
        return centers.size();
    }

    public List<Integer> members(int cluster) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < assignments.size(); i++) {
            if (assignments.get(i) == cluster) out.add(i);
        }
        return out;
    }
}
