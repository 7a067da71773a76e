package io.merkla.core.hash;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Named algorithms resolve, produce their documented digest lengths, and
 * match published test vectors.
 */
class HashAlgorithmTest {

    private static String hexOf(HashAlgorithm a, String input) {
        return HexFormat.of().formatHex(a.function().hash(input.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void digest_lengths_match_algorithm() {
        byte[] input = "merkle".getBytes(StandardCharsets.UTF_8);
        for (HashAlgorithm a : HashAlgorithm.values()) {
            if (a == HashAlgorithm.NONE) continue;
            assertEquals(a.digestLength(), a.function().hash(input).length, a.name());
        }
    }

    @Test
    void known_vectors() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                hexOf(HashAlgorithm.SHA256, "abc"));
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", hexOf(HashAlgorithm.MD5, ""));
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", hexOf(HashAlgorithm.SHA1, "abc"));
        assertEquals("9c1185a5c5e9fc54612808977ee8f548b2258d31", hexOf(HashAlgorithm.RIPEMD160, ""));
    }

    @Test
    void same_input_same_digest() {
        HashFunction fn = HashFunction.of(HashAlgorithm.WHIRLPOOL);
        byte[] data = "repeat".getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(fn.hash(data), fn.hash(data));
    }

    @Test
    void none_is_identity_and_copies() {
        byte[] data = { 1, 2, 3 };
        byte[] out = HashAlgorithm.NONE.function().hash(data);

        assertArrayEquals(data, out);
        assertNotSame(data, out);
    }

    @Test
    void names_resolve_case_insensitively() {
        assertEquals(HashAlgorithm.SHA256, HashAlgorithm.fromName("sha256"));
        assertEquals(HashAlgorithm.RIPEMD160, HashAlgorithm.fromName("RIPEMD160"));
        assertEquals(HashAlgorithm.WHIRLPOOL, HashAlgorithm.fromName(" Whirlpool "));

        assertTrue(HashAlgorithm.isSupported("md5"));
        assertFalse(HashAlgorithm.isSupported("sha3"));
        assertFalse(HashAlgorithm.isSupported(null));
        assertEquals(7, HashAlgorithm.supportedNames().size());
    }

    @Test
    void unknown_name_is_rejected() {
        var e = assertThrows(IllegalArgumentException.class, () -> HashAlgorithm.fromName("blake3"));
        assertTrue(e.getMessage().contains("blake3"));

        assertThrows(IllegalArgumentException.class, () -> HashAlgorithm.fromName(" "));
    }
}
