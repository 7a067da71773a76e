package io.merkla.core;

import io.merkla.core.hash.HashAlgorithm;
import io.merkla.core.merkle.MerkleTree;
import io.merkla.core.merkle.PairingMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies tree options can be loaded from JSON and derived fluently.
 */
class TreeOptionsTest {

    @TempDir
    Path tmp;

    @Test
    void loads_algorithm_and_sort_pairs_from_json() throws Exception {
        Path cfgPath = tmp.resolve("tree.json");
        Files.writeString(cfgPath, """
                {
                  "hashAlgorithm": "sha512",
                  "sortPairs": true
                }
                """);

        TreeOptions options = TreeOptions.fromJsonFile(cfgPath);

        assertEquals("sha512", options.algorithmName());
        assertEquals(PairingMode.SORTED, options.pairing());
        assertTrue(options.sortPairs());
        assertEquals(64, options.hashFunction().hash(new byte[] { 1 }).length);
    }

    @Test
    void missing_fields_fall_back_to_defaults() throws Exception {
        Path cfgPath = tmp.resolve("empty.json");
        Files.writeString(cfgPath, "{}");

        TreeOptions options = TreeOptions.fromJsonFile(cfgPath);

        assertEquals("sha256", options.algorithmName());
        assertEquals(PairingMode.CONCATENATE, options.pairing());

        var data = List.of("a", "b", "c");
        assertArrayEquals(
                MerkleTree.buildFromStrings(data).root(),
                MerkleTree.buildFromStrings(data, options).root());
    }

    @Test
    void unknown_algorithm_is_rejected() throws Exception {
        Path cfgPath = tmp.resolve("bad-alg.json");
        Files.writeString(cfgPath, "{\"hashAlgorithm\": \"crc32\"}");

        assertThrows(IllegalArgumentException.class, () -> TreeOptions.fromJsonFile(cfgPath));
    }

    @Test
    void unreadable_or_unknown_fields_fail_with_io_error() throws Exception {
        Path garbage = tmp.resolve("garbage.json");
        Files.writeString(garbage, "{ not json");
        assertThrows(UncheckedIOException.class, () -> TreeOptions.fromJsonFile(garbage));

        Path extra = tmp.resolve("extra.json");
        Files.writeString(extra, "{\"hashAlgorithm\": \"sha1\", \"levels\": 3}");
        assertThrows(UncheckedIOException.class, () -> TreeOptions.fromJsonFile(extra));

        assertThrows(UncheckedIOException.class, () -> TreeOptions.fromJsonFile(tmp.resolve("missing.json")));
    }

    @Test
    void with_methods_replace_one_field() {
        TreeOptions base = TreeOptions.defaults();

        TreeOptions sorted = base.withPairing(PairingMode.SORTED);
        assertEquals("sha256", sorted.algorithmName());
        assertEquals(PairingMode.SORTED, sorted.pairing());

        TreeOptions md5 = sorted.withAlgorithm(HashAlgorithm.MD5);
        assertEquals("md5", md5.algorithmName());
        assertEquals(PairingMode.SORTED, md5.pairing());

        TreeOptions custom = base.withHashFunction(data -> new byte[] { 7 });
        assertEquals(TreeOptions.CUSTOM, custom.algorithmName());
        assertArrayEquals(new byte[] { 7 }, custom.hashFunction().hash(new byte[0]));
    }

    @Test
    void trees_with_different_options_coexist() {
        var data = List.of("a", "b", "c", "d");
        MerkleTree sha = MerkleTree.buildFromStrings(data, TreeOptions.of(HashAlgorithm.SHA256));
        MerkleTree ripemd = MerkleTree.buildFromStrings(data, TreeOptions.of(HashAlgorithm.RIPEMD160));

        assertEquals(32, sha.root().length);
        assertEquals(20, ripemd.root().length);
        assertTrue(sha.verify(sha.leafHash(3), sha.proveInclusion(3)));
        assertTrue(ripemd.verify(ripemd.leafHash(3), ripemd.proveInclusion(3)));
    }
}
