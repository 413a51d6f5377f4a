package tech.noetzold.phishing_detector.ncd;

import tech.noetzold.phishing_detector.model.ByteSequence;

/**
 * Normalized Compression Distance:
 * {@code (C(xy) - min(C(x), C(y))) / max(C(x), C(y))}.
 *
 * <p>All three sizes come from the same {@link CompressionOracle}. Results are clamped at 0
 * and may slightly exceed 1 on tiny inputs, where compressor framing dominates.
 * Byte-identical inputs are at distance 0 without compressing the pair.</p>
 */
public class NcdMetric {

    private final CompressionOracle oracle;

    public NcdMetric(CompressionOracle oracle) {
        this.oracle = oracle;
    }

    public double distance(ByteSequence x, ByteSequence y) {
        if (x.equals(y)) {
            return 0.0;
        }
        int cx = oracle.compressedSize(x);
        int cy = oracle.compressedSize(y);
        int cxy = oracle.jointCompressedSize(x, y);
        double d = (cxy - Math.min(cx, cy)) / (double) Math.max(cx, cy);
        return Math.max(0.0, d);
    }

    public CompressionOracle oracle() {
        return oracle;
    }
}
