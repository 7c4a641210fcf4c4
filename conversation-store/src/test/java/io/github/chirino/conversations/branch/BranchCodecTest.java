package io.github.chirino.conversations.branch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class BranchCodecTest {

    @Test
    void root_has_a_single_key_regardless_of_trailing_zeros() {
        assertEquals("0", BranchCodec.encode(BranchCoordinate.of()));
        assertEquals("0", BranchCodec.encode(BranchCoordinate.of(0)));
        assertEquals("0", BranchCodec.encode(BranchCoordinate.of(0, 0, 0)));
        assertEquals("0", BranchCodec.encode(null));
    }

    @Test
    void encode_strips_trailing_zeros_only() {
        assertEquals("0_1", BranchCodec.encode(BranchCoordinate.of(0, 1, 0)));
        assertEquals("1", BranchCodec.encode(BranchCoordinate.of(1, 0)));
        assertEquals("2_0_3", BranchCodec.encode(BranchCoordinate.of(2, 0, 3, 0, 0)));
    }

    @Test
    void decode_keeps_the_stored_digits() {
        assertEquals(BranchCoordinate.of(0, 1, 0), BranchCodec.decode("0_1_0"));
        assertEquals(BranchCoordinate.of(12), BranchCodec.decode("12"));
    }

    @Test
    void decode_of_encode_names_the_same_branch() {
        for (BranchCoordinate coordinate :
                List.of(
                        BranchCoordinate.of(),
                        BranchCoordinate.of(0, 0),
                        BranchCoordinate.of(3, 0, 1),
                        BranchCoordinate.of(0, 2, 0, 0))) {
            BranchCoordinate decoded = BranchCodec.decode(BranchCodec.encode(coordinate));
            assertTrue(decoded.isSameBranch(coordinate), coordinate.toString());
            assertEquals(coordinate.canonical(), decoded);
        }
    }

    @Test
    void malformed_keys_are_rejected() {
        for (String key : List.of("", "_", "0__1", "1_", "a", "0_-1", "1.5", "99999999999")) {
            assertThrows(CorruptBranchKeyException.class, () -> BranchCodec.decode(key), key);
        }
        assertThrows(CorruptBranchKeyException.class, () -> BranchCodec.decode(null));
    }

    @Test
    void prefix_pads_and_truncates() {
        assertEquals(BranchCoordinate.of(1, 0, 0), BranchCodec.pad(BranchCoordinate.of(1), 3));
        assertEquals(BranchCoordinate.of(1, 2), BranchCodec.prefix(BranchCoordinate.of(1, 2, 3), 2));
        assertEquals(0, BranchCodec.prefix(BranchCoordinate.of(1, 2), 0).size());
    }
}
