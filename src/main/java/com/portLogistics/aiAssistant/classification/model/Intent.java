package com.portLogistics.aiAssistant.classification.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed intent vocabulary shared by the pattern classifier, the LLM classifier and the access policy.
 *
 * Each intent declares the entities an agent expects to find (and the ones it can use when present),
 * which is reported back as the entities hint of an {@link IntentResult}.
 */
public enum Intent {

    HELP("help", List.of(), List.of()),
    BOOKING_STATUS("booking_status", List.of("booking_ref"), List.of("terminal")),
    BOOKING_CREATE("booking_create", List.of("terminal", "date"), List.of("gate", "slot_id", "carrier_id")),
    SLOT_AVAILABILITY("slot_availability", List.of("terminal", "date"), List.of("gate")),
    PASSAGE_HISTORY("passage_history", List.of(), List.of("terminal", "date")),
    BLOCKCHAIN_AUDIT("blockchain_audit", List.of("booking_ref"), List.of()),
    CARRIER_SCORE("carrier_score", List.of("carrier_id"), List.of()),
    OPERATOR_ANALYTICS("operator_analytics", List.of(), List.of("terminal")),
    SMALLTALK("smalltalk", List.of(), List.of()),
    UNKNOWN("unknown", List.of(), List.of());

    private final String wireName;
    private final List<String> expectedEntities;
    private final List<String> optionalEntities;

    Intent(String wireName, List<String> expectedEntities, List<String> optionalEntities) {
        this.wireName = wireName;
        this.expectedEntities = expectedEntities;
        this.optionalEntities = optionalEntities;
    }

    public String getWireName() {
        return wireName;
    }

    public List<String> getExpectedEntities() {
        return expectedEntities;
    }

    public List<String> getOptionalEntities() {
        return optionalEntities;
    }

    /**
     * Intents exempt from role authorization.
     */
    public boolean isBypass() {
        return this == HELP || this == UNKNOWN;
    }

    /**
     * Intents that carry no reusable meaning for a follow-up message.
     */
    public boolean isLowInformation() {
        return this == UNKNOWN || this == HELP || this == SMALLTALK;
    }

    /**
     * Looks up an intent by its wire name (case-insensitive, surrounding whitespace ignored).
     *
     * @param value Wire name such as "booking_status"
     * @return Matching intent, or empty if the value is outside the closed vocabulary
     */
    public static Optional<Intent> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(intent -> intent.wireName.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
