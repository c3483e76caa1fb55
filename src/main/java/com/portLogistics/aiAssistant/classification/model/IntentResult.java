package com.portLogistics.aiAssistant.classification.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of classifying a single message.
 *
 * Immutable once produced: reasoning is the ordered list of rule identifiers (or classifier steps)
 * that led to the intent, entities holds whatever the classifier itself extracted (the LLM path
 * reports entities, the pattern path leaves them empty).
 */
@Value
@Builder(toBuilder = true)
public class IntentResult {

    Intent intent;

    /**
     * Self-reported certainty in [0, 1].
     */
    double confidence;

    @Singular("reason")
    List<String> reasoning;

    @Singular
    Map<String, Object> entities;

    /**
     * Entities the intent's agent needs, and the ones it can use when present.
     */
    public EntitiesHint getEntitiesHint() {
        return EntitiesHint.forIntent(intent);
    }

    public boolean isUnknown() {
        return intent == Intent.UNKNOWN;
    }

    public static IntentResult unknown(double confidence, String reason) {
        return IntentResult.builder()
                .intent(Intent.UNKNOWN)
                .confidence(confidence)
                .reason(reason)
                .build();
    }

    @Value
    public static class EntitiesHint {
        List<String> expected;
        List<String> optional;

        static EntitiesHint forIntent(Intent intent) {
            if (intent == null) {
                return new EntitiesHint(List.of(), List.of());
            }
            return new EntitiesHint(intent.getExpectedEntities(), intent.getOptionalEntities());
        }
    }
}
