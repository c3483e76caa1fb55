package com.portLogistics.aiAssistant.classification.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured fields pulled out of a raw message.
 *
 * Keys are optional and independent. Values are either strings (terminal, gate, slot_id,
 * carrier_id, booking_ref, date_explicit) or boolean flags (date_today, date_tomorrow, date_yesterday).
 */
@ToString
@EqualsAndHashCode
public class ExtractedEntities {

    public static final String TERMINAL = "terminal";
    public static final String GATE = "gate";
    public static final String SLOT_ID = "slot_id";
    public static final String CARRIER_ID = "carrier_id";
    public static final String BOOKING_REF = "booking_ref";
    public static final String DATE_TODAY = "date_today";
    public static final String DATE_TOMORROW = "date_tomorrow";
    public static final String DATE_YESTERDAY = "date_yesterday";
    public static final String DATE_EXPLICIT = "date_explicit";

    private final Map<String, Object> values;

    private ExtractedEntities(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ExtractedEntities empty() {
        return new ExtractedEntities(Map.of());
    }

    public static ExtractedEntities of(Map<String, Object> values) {
        return new ExtractedEntities(values != null ? values : Map.of());
    }

    /**
     * Returns a copy where entries of {@code other} fill keys missing here.
     * Existing keys are never overwritten.
     */
    public ExtractedEntities withDefaults(Map<String, Object> other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        other.forEach((key, value) -> {
            if (value != null) {
                merged.putIfAbsent(key, value);
            }
        });
        return new ExtractedEntities(merged);
    }

    public String getString(String key) {
        Object value = values.get(key);
        return value != null ? value.toString() : null;
    }

    public boolean isFlagSet(String key) {
        return Boolean.TRUE.equals(values.get(key));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
