package com.portLogistics.aiAssistant.access.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Roles known to the access policy. Any other role string falls into the unrecognized bucket.
 */
public enum UserRole {
    ADMIN,
    OPERATOR,
    CARRIER;

    /**
     * Parses a role string after trimming and upper-casing it.
     *
     * @param role Role as received from the caller
     * @return Matching role, or empty for missing or unrecognized roles
     */
    public static Optional<UserRole> parse(String role) {
        if (role == null || role.isBlank()) {
            return Optional.empty();
        }
        String normalized = role.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(value -> value.name().equals(normalized))
                .findFirst();
    }
}
