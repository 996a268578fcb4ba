package com.voxelmap.util;

/**
 * Signed base-36 codec for the legacy per-chunk file names
 * ({@code c.<x>.<z>.dat}, coordinates in base 36).
 */
public final class Base36 {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private Base36() {}

    public static String encode(long number) {
        if (number == 0) return "0";

        StringBuilder sb = new StringBuilder();
        long n = number;
        // work in negatives so Long.MIN_VALUE doesn't overflow
        if (n > 0) n = -n;
        while (n != 0) {
            sb.append(ALPHABET.charAt((int) -(n % 36)));
            n /= 36;
        }
        if (number < 0) sb.append('-');
        return sb.reverse().toString();
    }

    /**
     * @throws NumberFormatException if {@code s} is not a base-36 number
     */
    public static long decode(String s) {
        return Long.parseLong(s, 36);
    }
}
