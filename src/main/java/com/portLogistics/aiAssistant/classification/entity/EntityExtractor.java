package com.portLogistics.aiAssistant.classification.entity;

import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured fields out of raw message text.
 *
 * Each field has its own independent extractor, so a message may yield any subset of fields.
 * Date keywords only set flags; turning them into calendar dates is left to
 * {@link com.portLogistics.aiAssistant.agent.service.BookingDateResolver}.
 */
@Slf4j
@Service
public class EntityExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern TERMINAL = Pattern.compile("\\bterminal\\s+([a-z]\\d?|\\d{1,2})\\b", FLAGS);
    private static final Pattern GATE_AFTER_KEYWORD = Pattern.compile("\\b(?:gate|porte)\\s+(g?\\d+|[a-z]\\d*)\\b", FLAGS);
    private static final Pattern GATE_CODE = Pattern.compile("\\b(g\\d+)\\b", FLAGS);
    private static final Pattern SLOT_ID = Pattern.compile("\\b(slot-[a-z0-9]+(?:-[a-z0-9]+)*)", FLAGS);
    private static final Pattern CARRIER_ID = Pattern.compile("\\b(?:carrier|transporteur)\\s*(?:id)?\\s*[#:]?\\s*(\\d+)\\b", FLAGS);
    private static final Pattern BOOKING_REF = Pattern.compile("\\b(?:ref|bk)[-\\s#]?(\\d+)\\b", FLAGS);
    private static final Pattern DATE_EXPLICIT = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");

    private static final Pattern TERMINAL_VALUE = Pattern.compile("^(?:terminal\\s+)?([a-z]\\d?|\\d{1,2})$", FLAGS);
    private static final Pattern GATE_VALUE = Pattern.compile("^(?:gate\\s+|porte\\s+)?(g?\\d+|[a-z]\\d*)$", FLAGS);
    private static final Pattern SLOT_ID_VALUE = Pattern.compile("^[a-z0-9]+(?:-[a-z0-9]+)*$", FLAGS);
    private static final Pattern DIGITS = Pattern.compile("(\\d+)");
    private static final Pattern ISO_DATE_VALUE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private static final Pattern TODAY = Pattern.compile("\\b(today|aujourd'hui|aujourd’hui|lyoum)\\b", FLAGS);
    private static final Pattern TOMORROW = Pattern.compile("\\b(tomorrow|demain|ghodwa)\\b", FLAGS);
    private static final Pattern YESTERDAY = Pattern.compile("\\b(yesterday|hier|lbareh)\\b", FLAGS);

    /**
     * Extracts entities from a message.
     *
     * @param text Raw message (null and blank are accepted)
     * @return Extracted entities, empty when nothing was found
     */
    public ExtractedEntities extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractedEntities.empty();
        }

        Map<String, Object> entities = new LinkedHashMap<>();

        firstGroup(TERMINAL, text)
                .ifPresentUpper(value -> entities.put(ExtractedEntities.TERMINAL, value));

        Capture gate = firstGroup(GATE_AFTER_KEYWORD, text);
        if (!gate.isPresent()) {
            gate = firstGroup(GATE_CODE, text);
        }
        gate.ifPresentUpper(value -> entities.put(ExtractedEntities.GATE, value));

        firstGroup(SLOT_ID, text)
                .ifPresentUpper(value -> entities.put(ExtractedEntities.SLOT_ID, value));
        firstGroup(CARRIER_ID, text)
                .ifPresentUpper(value -> entities.put(ExtractedEntities.CARRIER_ID, value));
        firstGroup(BOOKING_REF, text)
                .ifPresentUpper(value -> entities.put(ExtractedEntities.BOOKING_REF, value));

        if (TODAY.matcher(text).find()) {
            entities.put(ExtractedEntities.DATE_TODAY, Boolean.TRUE);
        }
        if (TOMORROW.matcher(text).find()) {
            entities.put(ExtractedEntities.DATE_TOMORROW, Boolean.TRUE);
        }
        if (YESTERDAY.matcher(text).find()) {
            entities.put(ExtractedEntities.DATE_YESTERDAY, Boolean.TRUE);
        }
        firstGroup(DATE_EXPLICIT, text)
                .ifPresentUpper(value -> entities.put(ExtractedEntities.DATE_EXPLICIT, value));

        log.debug("Entities extracted - keys: {}", entities.keySet());
        return ExtractedEntities.of(entities);
    }

    /**
     * Brings entities reported by another source (the LLM classifier) into the forms {@link #extract(String)}
     * produces: uppercase terminal, gate and slot id, digit-only booking and carrier ids, and a {@code date}
     * value mapped to {@code date_explicit} or to a relative date flag. Unknown keys and values that do not
     * fit their field are dropped.
     *
     * @param reported Raw entity map, possibly null
     * @return Normalized entities
     */
    public ExtractedEntities normalize(Map<String, Object> reported) {
        if (reported == null || reported.isEmpty()) {
            return ExtractedEntities.empty();
        }

        Map<String, Object> entities = new LinkedHashMap<>();
        reported.forEach((key, value) -> {
            String text = scalarText(value);
            if (key == null || text == null) {
                return;
            }
            switch (key.trim().toLowerCase(Locale.ROOT)) {
                case ExtractedEntities.TERMINAL -> firstGroup(TERMINAL_VALUE, text)
                        .ifPresentUpper(v -> entities.put(ExtractedEntities.TERMINAL, v));
                case ExtractedEntities.GATE -> firstGroup(GATE_VALUE, text)
                        .ifPresentUpper(v -> entities.put(ExtractedEntities.GATE, v));
                case ExtractedEntities.SLOT_ID -> {
                    String slotId = text.replaceAll("\\s+", "-");
                    if (SLOT_ID_VALUE.matcher(slotId).matches()) {
                        entities.put(ExtractedEntities.SLOT_ID, slotId.toUpperCase(Locale.ROOT));
                    }
                }
                case ExtractedEntities.BOOKING_REF, ExtractedEntities.CARRIER_ID -> firstGroup(DIGITS, text)
                        .ifPresentUpper(v -> entities.put(key.trim().toLowerCase(Locale.ROOT), v));
                case "date", ExtractedEntities.DATE_EXPLICIT -> putDate(text, entities);
                case ExtractedEntities.DATE_TODAY, ExtractedEntities.DATE_TOMORROW, ExtractedEntities.DATE_YESTERDAY -> {
                    if (Boolean.parseBoolean(text)) {
                        entities.put(key.trim().toLowerCase(Locale.ROOT), Boolean.TRUE);
                    }
                }
                default -> log.debug("Dropping unsupported entity: {}", key);
            }
        });
        return ExtractedEntities.of(entities);
    }

    private static void putDate(String text, Map<String, Object> entities) {
        if (ISO_DATE_VALUE.matcher(text).matches()) {
            entities.put(ExtractedEntities.DATE_EXPLICIT, text);
        } else if (TODAY.matcher(text).find()) {
            entities.put(ExtractedEntities.DATE_TODAY, Boolean.TRUE);
        } else if (TOMORROW.matcher(text).find()) {
            entities.put(ExtractedEntities.DATE_TOMORROW, Boolean.TRUE);
        } else if (YESTERDAY.matcher(text).find()) {
            entities.put(ExtractedEntities.DATE_YESTERDAY, Boolean.TRUE);
        }
    }

    private static String scalarText(Object value) {
        if (value instanceof Number) {
            Number number = (Number) value;
            return number.doubleValue() == Math.rint(number.doubleValue())
                    ? Long.toString(number.longValue())
                    : number.toString();
        }
        if (value instanceof String || value instanceof Boolean) {
            String text = value.toString().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private static Capture firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return new Capture(matcher.find() ? matcher.group(1) : null);
    }

    private record Capture(String value) {

        boolean isPresent() {
            return value != null && !value.isBlank();
        }

        void ifPresentUpper(Consumer<String> consumer) {
            if (isPresent()) {
                consumer.accept(value.toUpperCase(Locale.ROOT));
            }
        }
    }
}
