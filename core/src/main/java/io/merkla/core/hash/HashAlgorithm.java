package io.merkla.core.hash;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Security;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Named digest algorithms a tree can be configured with.
 * <p>
 * Each constant carries:
 *  - the canonical lowercase name used in options files ("sha256", "ripemd160", ...),
 *  - the JCA algorithm name used to look up a {@link MessageDigest},
 *  - the digest length in bytes.
 * <p>
 * NONE is the identity function. It is only meaningful for tests and for
 * inputs that are already digests.
 */
public enum HashAlgorithm {
    MD5("md5", "MD5", 16),
    SHA1("sha1", "SHA-1", 20),
    SHA256("sha256", "SHA-256", 32),
    SHA512("sha512", "SHA-512", 64),
    RIPEMD160("ripemd160", "RIPEMD160", 20),
    WHIRLPOOL("whirlpool", "WHIRLPOOL", 64),
    NONE("none", null, -1);

    static {
        // RIPEMD160 and WHIRLPOOL are not shipped by the JDK providers
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private final String canonicalName;
    private final String jcaName;
    private final int digestLength;

    HashAlgorithm(String canonicalName, String jcaName, int digestLength) {
        this.canonicalName = canonicalName;
        this.jcaName = jcaName;
        this.digestLength = digestLength;
    }

    /** Lowercase name as written in options files and used by the JSON form. */
    public String canonicalName() { return canonicalName; }

    /** Digest length in bytes, or -1 for NONE (output length equals input length). */
    public int digestLength() { return digestLength; }

    /**
     * Stateless hash function for this algorithm.
     * A fresh MessageDigest is created per call so the function can be shared.
     */
    public HashFunction function() {
        if (this == NONE) {
            return data -> data.clone();
        }
        // Fail on first use rather than deep inside tree construction.
        newDigest();
        return data -> newDigest().digest(data);
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("digest not available: " + jcaName, e);
        }
    }

    /**
     * Resolve an algorithm by its canonical name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not one of {@link #supportedNames()}
     */
    public static HashAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("hash algorithm name must not be blank");
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (HashAlgorithm a : values()) {
            if (a.canonicalName.equals(wanted)) return a;
        }
        throw new IllegalArgumentException(
                "unsupported hash algorithm: %s (supported: %s)".formatted(name, supportedNames()));
    }

    public static boolean isSupported(String name) {
        if (name == null) return false;
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return supportedNames().contains(wanted);
    }

    public static List<String> supportedNames() {
        return Arrays.stream(values()).map(HashAlgorithm::canonicalName).toList();
    }
}
