package com.equixtate.common;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Human-readable ids of the form PREFIX-epochMillis-RANDOM (e.g. PROP-1718000000000-K3F9ZQ2LA).
 */
public final class PrefixedIds {

    public static final String PROPERTY = "PROP";
    public static final String VERIFICATION = "VRF";
    public static final String FILE = "FILE";

    private static final char[] ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();
    private static final int RANDOM_LENGTH = 12;

    private PrefixedIds() {
    }

    public static String next(String prefix, Clock clock) {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        char[] suffix = new char[RANDOM_LENGTH];
        for (int i = 0; i < suffix.length; i++) {
            suffix[i] = ALPHABET[r.nextInt(ALPHABET.length)];
        }
        return prefix + "-" + clock.millis() + "-" + new String(suffix);
    }
}
