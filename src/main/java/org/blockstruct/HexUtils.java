package org.blockstruct;

import java.util.Locale;

public final class HexUtils {
    private HexUtils() {}

    /**
     * Parses an unsigned offset written either as hex with a 0x/0X prefix or as decimal.
     *
     * @throws NumberFormatException if the token is neither
     */
    public static long parseOffset(String token) {
        if (token == null || token.isEmpty())
            throw new NumberFormatException("empty offset");
        String t = token.toLowerCase(Locale.ROOT);
        boolean hex = t.startsWith("0x");
        String digits = hex ? t.substring(2) : t;
        if (digits.isEmpty()) throw new NumberFormatException("missing hex digits: " + token);
        // parseUnsignedLong takes a leading '+'
        if (digits.charAt(0) == '+' || digits.charAt(0) == '-')
            throw new NumberFormatException("signed offset: " + token);
        return Long.parseUnsignedLong(digits, hex ? 16 : 10);
    }

    /** Like {@link #parseOffset(String)}, but tolerates a leading '#' and returns null instead of failing */
    public static Long tryParseOffset(String token) {
        if (token == null) return null;
        String t = token.trim();
        if (t.startsWith("#")) t = t.substring(1);
        try {
            return parseOffset(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String formatAddress(long address) {
        return "0x" + Long.toHexString(address);
    }
}
