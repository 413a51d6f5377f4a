package tech.noetzold.phishing_detector.clustering;

import org.junit.jupiter.api.Test;
import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.ncd.CompressionOracle;
import tech.noetzold.phishing_detector.ncd.NcdMetric;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DistanceMatrixTest {

    private final NcdMetric metric = new NcdMetric(new CompressionOracle(6, 1000));

    private final List<ByteSequence> pool = List.of(
            ByteSequence.utf8("html head body form input input button ".repeat(10)),
            ByteSequence.utf8("html head body div div span a a a ".repeat(10)),
            ByteSequence.utf8("html head body iframe script ".repeat(10)),
            ByteSequence.utf8("html head body form input input button ".repeat(9) + "img"));

    @Test
    void computedMatrixIsSymmetricWithZeroDiagonal() {
        DistanceMatrix m = DistanceMatrix.compute(pool, metric, false);

        assertEquals(pool.size(), m.size());
        for (int i = 0; i < m.size(); i++) {
            assertEquals(0.0, m.get(i, i));
            for (int j = 0; j < m.size(); j++) {
                assertEquals(m.get(i, j), m.get(j, i));
                assertTrue(m.get(i, j) >= 0.0);
            }
        }
    }

    @Test
    void parallelComputationMatchesSequential() {
        DistanceMatrix seq = DistanceMatrix.compute(pool, metric, false);
        DistanceMatrix par = DistanceMatrix.compute(pool, metric, true);

        for (int i = 0; i < pool.size(); i++) {
            for (int j = 0; j < pool.size(); j++) {
                assertEquals(seq.get(i, j), par.get(i, j));
            }
        }
    }

    @Test
    void rowAverageIncludesDiagonal() {
        DistanceMatrix m = DistanceMatrix.of(new double[][]{
                {0.0, 0.3, 0.6},
                {0.3, 0.0, 0.9},
                {0.6, 0.9, 0.0}});
        assertEquals(0.3, m.rowAverage(0), 1e-12);
        assertEquals(0.5, m.rowAverage(2), 1e-12);
    }

    @Test
    void rejectsMalformedTables() {
        assertThrows(IllegalArgumentException.class, () -> DistanceMatrix.of(new double[][]{{0.0, 0.1}}));
        assertThrows(IllegalArgumentException.class, () -> DistanceMatrix.of(new double[][]{{0.0, 0.1}, {0.2, 0.0}}));
        assertThrows(IllegalArgumentException.class, () -> DistanceMatrix.of(new double[][]{{0.5, 0.1}, {0.1, 0.0}}));
    }
}
