package com.equixtate.oracle;

import com.equixtate.common.ContentHash;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * ABI-style encoding of (address owner, uint256 declaredValue, bytes32[] documentHashes).
 * Head: owner word, value word, offset of the array (0x60). Tail: array length, then one word per hash.
 */
public final class OracleParamsEncoder {

    private static final int WORD_HEX = 64;
    private static final int MAX_ADDRESS_HEX = 40;
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]+$");

    private OracleParamsEncoder() {
    }

    /**
     * @param declaredValue whole-dollar value; fractions are floored, null encodes as zero
     * @throws IllegalArgumentException for a non-hex or over-long owner, negative or over-wide value,
     *                                  or a malformed document hash
     */
    public static String encode(String owner, BigDecimal declaredValue, List<String> documentHashes) {
        StringBuilder out = new StringBuilder("0x");
        out.append(addressWord(owner));
        out.append(uintWord(declaredValue == null ? BigInteger.ZERO
                : declaredValue.setScale(0, RoundingMode.FLOOR).toBigIntegerExact()));
        out.append(uintWord(BigInteger.valueOf(3L * 32)));
        out.append(uintWord(BigInteger.valueOf(documentHashes.size())));
        for (String hash : documentHashes) {
            if (!ContentHash.isWellFormed(hash)) {
                throw new IllegalArgumentException("Malformed document hash: " + hash);
            }
            out.append(hash.substring(2));
        }
        return out.toString();
    }

    static String addressWord(String address) {
        if (address == null) {
            throw new IllegalArgumentException("Owner address is required");
        }
        String hex = address.strip();
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (hex.isEmpty() || hex.length() > MAX_ADDRESS_HEX || !HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("Owner is not an address: " + address);
        }
        return leftPad(hex.toLowerCase(Locale.ROOT));
    }

    static String uintWord(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("Value does not fit uint256: " + value);
        }
        return leftPad(value.toString(16));
    }

    private static String leftPad(String hex) {
        return "0".repeat(WORD_HEX - hex.length()) + hex;
    }
}
