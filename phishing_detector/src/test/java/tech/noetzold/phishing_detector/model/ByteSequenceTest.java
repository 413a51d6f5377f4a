package tech.noetzold.phishing_detector.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteSequenceTest {

    @Test
    void equalityIsByContent() {
        ByteSequence a = ByteSequence.of(new byte[]{1, 2, 3});
        ByteSequence b = ByteSequence.of(new byte[]{1, 2, 3});

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, ByteSequence.of(new byte[]{1, 2}));
    }

    @Test
    void callerArrayIsCopied() {
        byte[] raw = {7, 7};
        ByteSequence seq = ByteSequence.of(raw);
        raw[0] = 0;

        assertEquals(7, seq.toByteArray()[0]);
    }

    @Test
    void concatKeepsOrder() {
        ByteSequence joined = ByteSequence.utf8("html ").concat(ByteSequence.utf8("body"));
        assertEquals("html body", joined.asUtf8());
        assertEquals(9, joined.length());
    }

    @Test
    void emptyFactoriesAgree() {
        assertTrue(ByteSequence.utf8(null).isEmpty());
        assertEquals(ByteSequence.empty(), ByteSequence.of(new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> ByteSequence.of(null));
    }
}
