package com.portLogistics.aiAssistant.access.service;

import com.portLogistics.aiAssistant.access.model.AccessDecision;
import com.portLogistics.aiAssistant.access.model.UserRole;
import com.portLogistics.aiAssistant.classification.model.Intent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static role to allowed-intents table.
 *
 * Help and unknown are authorized for every caller, including unauthenticated ones and roles
 * outside the table. Every other intent requires a recognized role whose entry lists it.
 */
@Slf4j
@Service
public class AccessPolicy {

    private static final Map<UserRole, Set<Intent>> ALLOWED_INTENTS;

    static {
        Map<UserRole, Set<Intent>> table = new EnumMap<>(UserRole.class);
        table.put(UserRole.ADMIN, Collections.unmodifiableSet(EnumSet.allOf(Intent.class)));
        table.put(UserRole.OPERATOR, Collections.unmodifiableSet(EnumSet.of(
                Intent.BOOKING_STATUS,
                Intent.SLOT_AVAILABILITY,
                Intent.PASSAGE_HISTORY,
                Intent.BLOCKCHAIN_AUDIT,
                Intent.CARRIER_SCORE,
                Intent.OPERATOR_ANALYTICS,
                Intent.SMALLTALK)));
        table.put(UserRole.CARRIER, Collections.unmodifiableSet(EnumSet.of(
                Intent.BOOKING_STATUS,
                Intent.BOOKING_CREATE,
                Intent.SLOT_AVAILABILITY,
                Intent.PASSAGE_HISTORY,
                Intent.SMALLTALK)));
        ALLOWED_INTENTS = Collections.unmodifiableMap(table);
    }

    /**
     * @param intent Resolved intent
     * @param role   Caller role in any case, possibly null
     * @return true when the role may reach the intent's agent
     */
    public boolean authorize(Intent intent, String role) {
        if (intent == null) {
            return false;
        }
        if (intent.isBypass()) {
            return true;
        }
        return UserRole.parse(role)
                .map(ALLOWED_INTENTS::get)
                .map(allowed -> allowed.contains(intent))
                .orElse(false);
    }

    public AccessDecision decide(Intent intent, String role) {
        boolean allowed = authorize(intent, role);
        String normalizedRole = role == null || role.isBlank() ? "UNKNOWN" : role.trim().toUpperCase(Locale.ROOT);
        if (!allowed) {
            log.info("Access denied - role: {}, intent: {}", normalizedRole, intent);
        }
        return new AccessDecision(allowed, normalizedRole, intent);
    }

    /**
     * @param role Caller role in any case, possibly null
     * @return Intents the role may use, including the bypass intents
     */
    public Set<Intent> allowedIntents(String role) {
        Set<Intent> allowed = EnumSet.of(Intent.HELP, Intent.UNKNOWN);
        UserRole.parse(role).map(ALLOWED_INTENTS::get).ifPresent(allowed::addAll);
        return Collections.unmodifiableSet(allowed);
    }
}
