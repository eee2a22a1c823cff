package com.licensewatch.obits.reconcile.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtils {
    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Leading {@code length} hex characters of the SHA-256 digest; enough to tell file paths
     * apart inside a file name.
     */
    public static String shortHash(String value, int length) {
        String hex = sha256Hex(value);
        return hex.substring(0, Math.max(1, Math.min(length, hex.length())));
    }
}
