package com.ethindexer.common;

import java.math.BigInteger;

/**
 * Parsing helpers for 0x-prefixed JSON-RPC quantities.
 */
public final class HexUtils {

    private HexUtils() {
    }

    public static boolean hasHexPrefix(String value) {
        return value != null && value.length() >= 2 && value.charAt(0) == '0'
                && (value.charAt(1) == 'x' || value.charAt(1) == 'X');
    }

    public static String strip0x(String value) {
        return hasHexPrefix(value) ? value.substring(2) : value;
    }

    /**
     * Parses a 0x quantity. "0x" alone is zero.
     *
     * @throws NumberFormatException if the value is not 0x-prefixed hex
     */
    public static BigInteger toBigInteger(String hex) {
        if (!hasHexPrefix(hex)) {
            throw new NumberFormatException("Not a hex quantity: " + hex);
        }
        String digits = hex.substring(2);
        return digits.isEmpty() ? BigInteger.ZERO : new BigInteger(digits, 16);
    }

    public static String toHex(long value) {
        return "0x" + Long.toHexString(value);
    }

    /** True if every character of the string is '0'. Empty string counts as all zeros. */
    public static boolean isAllZeros(String hexDigits) {
        for (int i = 0; i < hexDigits.length(); i++) {
            if (hexDigits.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }
}
