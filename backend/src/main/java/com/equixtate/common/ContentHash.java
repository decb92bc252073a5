package com.equixtate.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * SHA3-256 content hashes rendered as 0x-prefixed lowercase hex (66 chars), the form used for
 * document fingerprints and attestation hashes.
 */
public final class ContentHash {

    public static final int HEX_LENGTH = 66;

    private static final String ALGORITHM = "SHA3-256";
    private static final Pattern WELL_FORMED = Pattern.compile("^0x[0-9a-f]{64}$");
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ContentHash() {
    }

    public static String of(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return "0x" + toHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            // SHA3-256 is mandatory on every JDK 9+ runtime
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    public static String of(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    /** Non-null, 0x-prefixed, 64 lowercase hex digits. */
    public static boolean isWellFormed(String hash) {
        return hash != null && WELL_FORMED.matcher(hash).matches();
    }

    public static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }
}
