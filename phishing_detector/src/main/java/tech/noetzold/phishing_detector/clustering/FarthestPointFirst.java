package tech.noetzold.phishing_detector.clustering;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Greedy farthest-point-first selection over a precomputed {@link DistanceMatrix}.
 * Each step depends on every earlier pick, so the selection loop stays sequential.
 * Ties always go to the lowest pool index.
 */
@Slf4j
public class FarthestPointFirst {

    private final Random random;

    public FarthestPointFirst(Random random) {
        this.random = random;
    }

    /**
     * Picks {@code k} mutually distant pool indices. Returns the whole pool when {@code k >= n}.
     */
    public List<Integer> select(DistanceMatrix m, int k, SeedPolicy seed) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        int n = m.size();
        if (k >= n) {
            log.warn("Requested {} prototypes but pool has only {}; using the whole pool", k, n);
            return IntStream.range(0, n).boxed().toList();
        }

        boolean[] chosen = new boolean[n];
        double[] nearest = new double[n];
        List<Integer> selected = new ArrayList<>(k);

        int first = seed(m, seed);
        take(m, first, chosen, nearest, selected);

        while (selected.size() < k) {
            int next = farthest(nearest, chosen);
            take(m, next, chosen, nearest, selected);
        }
        log.debug("FPF selected {} of {}: {}", k, n, selected);
        return List.copyOf(selected);
    }

    /**
     * Partitions the pool into between {@code minClusters} and {@code maxClusters} families.
     * Starts from the most atypical sample and stops adding centers once the variance of the
     * distance-to-nearest-center drops by less than {@code epsilon}, provided at least
     * {@code minClusters} centers exist.
     */
    public ClusteringResult cluster(DistanceMatrix m, int maxClusters, int minClusters, double epsilon) {
        if (maxClusters <= 0 || minClusters <= 0 || minClusters > maxClusters) {
            throw new IllegalArgumentException(
                    "Invalid cluster bounds min=" + minClusters + " max=" + maxClusters);
        }
        int n = m.size();
        if (n == 0) {
            throw new IllegalArgumentException("Cannot cluster an empty pool");
        }

        boolean[] chosen = new boolean[n];
        double[] nearest = new double[n];
        List<Integer> centers = new ArrayList<>();

        int first = seed(m, SeedPolicy.HIGHEST_AVERAGE_DISTANCE);
        take(m, first, chosen, nearest, centers);
        log.info("Initial center: sample {} (average distance {})", first, String.format("%.4f", m.rowAverage(first)));

        while (centers.size() < Math.min(maxClusters, n)) {
            int candidate = farthest(nearest, chosen);

            double before = variance(nearest);
            double[] trial = nearest.clone();
            for (int i = 0; i < n; i++) {
                trial[i] = Math.min(trial[i], m.get(candidate, i));
            }
            double reduction = before - variance(trial);

            log.info("Cluster {} candidate: sample {} (distance to nearest center {}, variance reduction {})",
                    centers.size() + 1, candidate,
                    String.format("%.4f", nearest[candidate]), String.format("%.6f", reduction));

            if (reduction < epsilon && centers.size() >= minClusters) {
                log.info("  stopping: variance reduction below {}", epsilon);
                break;
            }
            take(m, candidate, chosen, nearest, centers);
        }

        List<Integer> assignments = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            assignments.add(nearestCenter(m, i, centers));
        }
        log.info("Final number of clusters: {}", centers.size());
        return new ClusteringResult(assignments, centers);
    }

    static int nearestCenter(DistanceMatrix m, int point, List<Integer> centers) {
        int best = 0;
        double bestDistance = m.get(point, centers.get(0));
        for (int c = 1; c < centers.size(); c++) {
            double dist = m.get(point, centers.get(c));
            if (dist < bestDistance) {
                bestDistance = dist;
                best = c;
            }
        }
        return best;
    }

    static double variance(double[] values) {
        if (values.length == 0) return 0.0;
        double mean = 0.0;
        for (double v : values) mean += v;
        mean /= values.length;
        double sq = 0.0;
        for (double v : values) sq += (v - mean) * (v - mean);
        return sq / values.length;
    }

    private int seed(DistanceMatrix m, SeedPolicy policy) {
        if (policy == SeedPolicy.RANDOM) {
            return random.nextInt(m.size());
        }
        int best = 0;
        double bestAvg = m.rowAverage(0);
        for (int i = 1; i < m.size(); i++) {
            double avg = m.rowAverage(i);
            if (avg > bestAvg) {
                bestAvg = avg;
                best = i;
            }
        }
        return best;
    }

    private static int farthest(double[] nearest, boolean[] chosen) {
        int best = -1;
        double bestDistance = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < nearest.length; i++) {
            if (!chosen[i] && nearest[i] > bestDistance) {
                bestDistance = nearest[i];
                best = i;
            }
        }
        return best;
    }

    private static void take(DistanceMatrix m, int index, boolean[] chosen, double[] nearest, List<Integer> selected) {
        boolean firstPick = selected.isEmpty();
        chosen[index] = true;
        selected.add(index);
        for (int i = 0; i < nearest.length; i++) {
            double d = m.get(index, i);
            nearest[i] = firstPick ? d : Math.min(nearest[i], d);
        }
    }
}
