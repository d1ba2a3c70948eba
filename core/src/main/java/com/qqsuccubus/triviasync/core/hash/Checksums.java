package com.qqsuccubus.triviasync.core.hash;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hash helpers for change detection.
 * <p>
 * Murmur3 is used for delta checksums (hot path, many small payloads); SHA-256 for state
 * content hashes where a collision would hide a real conflict.
 * </p>
 */
public final class Checksums {
    private Checksums() {
    }

    /**
     * Murmur3 (32 bit) of a UTF-8 string, rendered in base 36.
     *
     * @param str Input string
     * @return Compact checksum, e.g. {@code "1x9kq3"}
     */
    public static String murmur3Base36(String str) {
        int hash = Hashing.murmur3_32_fixed().hashString(str, StandardCharsets.UTF_8).asInt();
        return Long.toString(Integer.toUnsignedLong(hash), 36);
    }

    /**
     * SHA-256 of a UTF-8 string as lowercase hex.
     *
     * @param str Input string
     * @return 64-character hex digest
     */
    public static String sha256Hex(String str) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(str.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(bytes.length * 2);
            for (byte b : bytes) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
