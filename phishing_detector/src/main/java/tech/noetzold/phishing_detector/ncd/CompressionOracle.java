package tech.noetzold.phishing_detector.ncd;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.XZOutputStream;
import tech.noetzold.phishing_detector.model.ByteSequence;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Compressed size of byte sequences under one fixed xz (LZMA2) preset.
 * Single-sequence sizes are memoized in a size-bounded cache; joint sizes are not, since
 * they depend on the pair.
 */
@Slf4j
public class CompressionOracle {

    private final int preset;
    private final Cache<ByteSequence, Integer> sizes;

    public CompressionOracle(int preset, long maxCachedEntries) {
        if (preset < LZMA2Options.PRESET_MIN || preset > LZMA2Options.PRESET_MAX) {
            throw new IllegalArgumentException("Compression preset must be 0..9, got " + preset);
        }
        if (maxCachedEntries <= 0) {
            throw new IllegalArgumentException("Cache size must be positive, got " + maxCachedEntries);
        }
        this.preset = preset;
        this.sizes = Caffeine.newBuilder()
                .maximumSize(maxCachedEntries)
                .recordStats()
                .build();
    }

    public int compressedSize(ByteSequence data) {
        return sizes.get(data, this::compress);
    }

    public int jointCompressedSize(ByteSequence x, ByteSequence y) {
        return compress(x.concat(y));
    }

    public CacheStats stats() {
        return sizes.stats();
    }

    public long cachedEntries() {
        return sizes.estimatedSize();
    }

    // empty input still yields the xz stream header and footer, never 0
    private int compress(ByteSequence data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length() / 4));
        try (XZOutputStream xz = new XZOutputStream(out, new LZMA2Options(preset))) {
            xz.write(data.unsafeBytes());
        } catch (IOException | RuntimeException e) {
            log.error("Compression failed for {}", data, e);
            throw new CompressionFailureException("Unable to compress " + data, e);
        }
        return out.size();
    }
}
