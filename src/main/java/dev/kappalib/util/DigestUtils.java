package dev.kappalib.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Hashing and comparison helpers for credential material.
 */
public final class DigestUtils {

    private static final HexFormat HEX = HexFormat.of();

    private DigestUtils() {
        // utility class
    }

    /**
     * Compares two secrets in time independent of where they differ. Both sides are
     * hashed first so the comparison length does not depend on the supplied value.
     * A null on either side never matches.
     */
    public static boolean constantTimeEquals(String expected, String provided) {
        if (expected == null || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                sha256(expected.getBytes(StandardCharsets.UTF_8)),
                sha256(provided.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Lowercase hex encoding of raw bytes.
     */
    public static String toHex(byte[] data) {
        Objects.requireNonNull(data, "Input must not be null");
        return HEX.formatHex(data);
    }

    /**
     * Compute raw SHA-256 hash bytes.
     *
     * @param data bytes to hash
     * @return SHA-256 digest bytes
     */
    public static byte[] sha256(byte[] data) {
        Objects.requireNonNull(data, "Input must not be null");
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
