package com.portLogistics.aiAssistant.gateway.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Replaces user ids with a short, stable fingerprint before they reach the logs.
 * No character of the id itself is logged; the same id always yields the same fingerprint,
 * so log lines of one user can still be correlated.
 */
public class UserIdMasker {

    static final String ANONYMOUS = "anonymous";
    private static final int FINGERPRINT_BYTES = 4;

    private UserIdMasker() {
    }

    /**
     * @param userId User id, possibly null
     * @return {@code user#<8 hex chars>}, or "anonymous" when no id was given
     */
    public static String mask(String userId) {
        if (userId == null || userId.isBlank()) {
            return ANONYMOUS;
        }
        byte[] digest = sha256(userId.trim());
        return "user#" + HexFormat.of().formatHex(digest, 0, FINGERPRINT_BYTES);
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
