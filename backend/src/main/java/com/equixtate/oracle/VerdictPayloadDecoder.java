package com.equixtate.oracle;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decodes the ABI-encoded verdict payload: four 32-byte words (address, bool, uint256, bytes32).
 */
public final class VerdictPayloadDecoder {

    static final int WORD_HEX = 64;
    private static final int WORDS = 4;
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]*$");

    private VerdictPayloadDecoder() {
    }

    /**
     * @throws IllegalArgumentException when the payload is missing, not hex, too short or the bool word is not 0/1
     */
    public static VerdictPayload decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("Empty verdict payload");
        }
        String raw = payload.startsWith("0x") || payload.startsWith("0X") ? payload.substring(2) : payload;
        if (!HEX.matcher(raw).matches()) {
            throw new IllegalArgumentException("Verdict payload is not hex");
        }
        if (raw.length() < WORDS * WORD_HEX) {
            throw new IllegalArgumentException("Verdict payload too short: " + raw.length() / 2 + " bytes");
        }
        raw = raw.toLowerCase(Locale.ROOT);
        String addressWord = word(raw, 0);
        String boolWord = word(raw, 1);
        String timestampWord = word(raw, 2);
        String hashWord = word(raw, 3);

        // address is right-aligned in its word (last 20 bytes)
        String address = "0x" + addressWord.substring(24);
        BigInteger flag = new BigInteger(boolWord, 16);
        if (flag.compareTo(BigInteger.ONE) > 0) {
            throw new IllegalArgumentException("Invalid bool word in verdict payload");
        }
        return new VerdictPayload(address, flag.equals(BigInteger.ONE), new BigInteger(timestampWord, 16),
                "0x" + hashWord);
    }

    private static String word(String raw, int index) {
        return raw.substring(index * WORD_HEX, (index + 1) * WORD_HEX);
    }
}
