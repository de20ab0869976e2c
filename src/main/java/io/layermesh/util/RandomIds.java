package io.layermesh.util;

import java.security.SecureRandom;

public final class RandomIds {
    private static final char[] ALPHABET =
            "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ-_".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomIds() {
    }

    /**
     * Short URL-safe identifier, used for layer names that the caller did not supply.
     */
    public static String createShortId(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("id length must be positive: " + length);
        }
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        StringBuilder sb = new StringBuilder(length);
        for (byte b : bytes) {
            sb.append(ALPHABET[b & 63]);
        }
        return sb.toString();
    }
}
