package tech.noetzold.phishing_detector.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Immutable byte content compared by value. Every DOM tag stream, resource
 * signature and prototype travels through the engine as one of these.
 */
public final class ByteSequence {

    private static final ByteSequence EMPTY = new ByteSequence(new byte[0]);

    private final byte[] bytes;
    private final int hash;

    private ByteSequence(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    public static ByteSequence of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes must not be null");
        }
        return bytes.length == 0 ? EMPTY : new ByteSequence(bytes.clone());
    }

    public static ByteSequence utf8(String text) {
        if (text == null || text.isEmpty()) return EMPTY;
        return new ByteSequence(text.getBytes(StandardCharsets.UTF_8));
    }

    public static ByteSequence empty() {
        return EMPTY;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    public ByteSequence concat(ByteSequence other) {
        byte[] joined = Arrays.copyOf(bytes, bytes.length + other.bytes.length);
        System.arraycopy(other.bytes, 0, joined, bytes.length, other.bytes.length);
        return new ByteSequence(joined);
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * Exposes the backing array to the compressor without copying. Callers must not mutate it.
     */
    public byte[] unsafeBytes() {
        return bytes;
    }

    public String asUtf8() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteSequence other)) return false;
        return hash == other.hash && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "ByteSequence[" + bytes.length + " bytes]";
    }
}
