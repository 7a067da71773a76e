package io.merkla.core.codec;

import java.util.HexFormat;
import java.util.regex.Pattern;

/** Lowercase hex rendering and strict hex validation shared by the codecs. */
final class Hex {
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");
    private static final HexFormat FORMAT = HexFormat.of();

    private Hex() {}

    static String encode(byte[] bytes) {
        return FORMAT.formatHex(bytes);
    }

    /**
     * Why {@code s} is not a usable hash, or null if it is.
     * Non-empty, hex digits only (either case), whole bytes.
     */
    static String problem(String s) {
        if (s == null || s.isEmpty()) return "must be a non-empty hex string";
        if (!HEX.matcher(s).matches()) return "contains a non-hex character";
        if ((s.length() & 1) == 1) return "has an odd number of hex digits";
        return null;
    }

    /** Caller must have checked {@link #problem(String)} first. */
    static byte[] decode(String s) {
        return FORMAT.parseHex(s);
    }
}
