package io.merkla.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.merkla.core.dto.JsonTreeOptions;
import io.merkla.core.hash.HashAlgorithm;
import io.merkla.core.hash.HashFunction;
import io.merkla.core.merkle.PairingMode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Construction-time configuration of a tree.
 *
 * Supports:
 *  - hashFunction:  digest applied to leaves and to concatenated child pairs
 *  - pairing:       how child hashes are combined (see {@link PairingMode})
 *  - algorithmName: label of the hash function, used in log lines only
 *
 * The hash function is passed explicitly so trees with different algorithms
 * can coexist.
 */
public record TreeOptions(
        HashFunction hashFunction,
        PairingMode pairing,
        String algorithmName
) {
    public static final String CUSTOM = "custom";

    public TreeOptions {
        Objects.requireNonNull(hashFunction, "hashFunction");
        Objects.requireNonNull(pairing, "pairing");
        Objects.requireNonNull(algorithmName, "algorithmName");
    }

    /** SHA-256 with plain concatenation. */
    public static TreeOptions defaults() {
        return of(HashAlgorithm.SHA256);
    }

    public static TreeOptions of(HashAlgorithm algorithm) {
        return new TreeOptions(algorithm.function(), PairingMode.CONCATENATE, algorithm.canonicalName());
    }

    public TreeOptions withAlgorithm(HashAlgorithm algorithm) {
        return new TreeOptions(algorithm.function(), pairing, algorithm.canonicalName());
    }

    public TreeOptions withHashFunction(HashFunction fn) {
        return new TreeOptions(fn, pairing, CUSTOM);
    }

    public TreeOptions withPairing(PairingMode mode) {
        return new TreeOptions(hashFunction, mode, algorithmName);
    }

    public boolean sortPairs() {
        return pairing == PairingMode.SORTED;
    }

    /**
     * Load options from a JSON file such as:
     * <pre>
     * { "hashAlgorithm": "sha512", "sortPairs": true }
     * </pre>
     * Missing fields fall back to {@link #defaults()}.
     *
     * @throws IllegalArgumentException if the algorithm name is not supported
     * @throws UncheckedIOException     if the file cannot be read or parsed
     */
    public static TreeOptions fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonTreeOptions cfg = mapper.readValue(path.toFile(), JsonTreeOptions.class);
            HashAlgorithm algorithm = cfg.hashAlgorithm != null
                    ? HashAlgorithm.fromName(cfg.hashAlgorithm)
                    : HashAlgorithm.SHA256;
            PairingMode mode = Boolean.TRUE.equals(cfg.sortPairs)
                    ? PairingMode.SORTED
                    : PairingMode.CONCATENATE;
            return of(algorithm).withPairing(mode);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load TreeOptions from " + path, e);
        }
    }
}
