package tech.noetzold.phishing_detector.clustering;

import lombok.extern.slf4j.Slf4j;
import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.ncd.NcdMetric;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.IntStream;

/**
 * Symmetric pairwise NCD table over a sample pool, zero on the diagonal. Lives for one
 * clustering run.
 */
@Slf4j
public final class DistanceMatrix {

    private final double[][] d;

    private DistanceMatrix(double[][] d) {
        this.d = d;
    }

    public static DistanceMatrix compute(List<ByteSequence> items, NcdMetric metric, boolean parallel) {
        int n = items.size();
        double[][] d = new double[n][n];
        long pairs = (long) n * (n - 1) / 2;
        AtomicLong done = new AtomicLong();
        long step = Math.max(1, pairs / 10);

        log.info("Computing {}x{} distance matrix ({} pairs{})", n, n, pairs, parallel ? ", parallel" : "");

        IntStream rows = IntStream.range(0, n);
        if (parallel) rows = rows.parallel();
        // each (i, j) cell with i < j is written by exactly one row task
        rows.forEach(i -> {
            for (int j = i + 1; j < n; j++) {
                double v = metric.distance(items.get(i), items.get(j));
                d[i][j] = v;
                d[j][i] = v;
                long k = done.incrementAndGet();
                if (k % step == 0) {
                    log.info("  progress {}% ({}/{} pairs)", k * 100 / pairs, k, pairs);
                }
            }
        });
        return new DistanceMatrix(d);
    }

    /**
     * Wraps precomputed distances. The table must be square, symmetric and zero on the diagonal.
     */
    public static DistanceMatrix of(double[][] values) {
        int n = values.length;
        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            if (values[i].length != n) {
                throw new IllegalArgumentException("Distance matrix must be square");
            }
            copy[i] = values[i].clone();
        }
        for (int i = 0; i < n; i++) {
            if (copy[i][i] != 0.0) {
                throw new IllegalArgumentException("Diagonal must be zero at " + i);
            }
            for (int j = i + 1; j < n; j++) {
                if (copy[i][j] != copy[j][i]) {
                    throw new IllegalArgumentException("Distance matrix not symmetric at " + i + "," + j);
                }
            }
        }
        return new DistanceMatrix(copy);
    }

    public int size() {
        return d.length;
    }

    public double get(int i, int j) {
        return d[i][j];
    }

    public double rowAverage(int i) {
        if (d.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : d[i]) sum += v;
        return sum / d.length;
    }
}
