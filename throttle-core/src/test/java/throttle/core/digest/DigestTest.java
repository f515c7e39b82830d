package throttle.core.digest;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class DigestTest {

    private static byte[] filled(int value) {
        byte[] b = new byte[Digest.LENGTH];
        Arrays.fill(b, (byte) value);
        return b;
    }

    @Test
    void of_copiesInput() {
        byte[] raw = filled(1);
        Digest d = Digest.of(raw);
        raw[0] = 9;

        assertEquals(1, d.byteAt(0));
    }

    @Test
    void ordering_isUnsigned() {
        Digest low = Digest.of(filled(0x01));
        Digest high = Digest.of(filled(0xF0));

        assertTrue(low.compareTo(high) < 0);
        assertEquals(0xF0, high.byteAt(0));
    }

    @Test
    void rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> Digest.of(new byte[16]));
        assertThrows(IllegalArgumentException.class, () -> Digest.of(null));
    }

    @Test
    void toString_isHex() {
        assertEquals("ff".repeat(Digest.LENGTH), Digest.of(filled(0xFF)).toString());
    }
}
