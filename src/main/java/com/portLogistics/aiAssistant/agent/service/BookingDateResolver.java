package com.portLogistics.aiAssistant.agent.service;

import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import com.portLogistics.aiAssistant.config.ClassificationSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Turns extracted date entities into a concrete ISO date in the port's timezone.
 * An explicit date wins over the relative flags.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingDateResolver {

    private final Clock clock;
    private final ClassificationSettings settings;

    public Optional<String> resolve(ExtractedEntities entities) {
        if (entities == null) {
            return Optional.empty();
        }
        String explicit = entities.getString(ExtractedEntities.DATE_EXPLICIT);
        if (explicit != null) {
            try {
                return Optional.of(LocalDate.parse(explicit).toString());
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unparseable explicit date: {}", explicit);
            }
        }
        LocalDate today = today();
        if (entities.isFlagSet(ExtractedEntities.DATE_TODAY)) {
            return Optional.of(today.toString());
        }
        if (entities.isFlagSet(ExtractedEntities.DATE_TOMORROW)) {
            return Optional.of(today.plusDays(1).toString());
        }
        if (entities.isFlagSet(ExtractedEntities.DATE_YESTERDAY)) {
            return Optional.of(today.minusDays(1).toString());
        }
        return Optional.empty();
    }

    /**
     * Same as {@link #resolve(ExtractedEntities)} but falls back to today when no date was given.
     */
    public String resolveOrToday(ExtractedEntities entities) {
        return resolve(entities).orElseGet(() -> today().toString());
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(settings.timezone()));
    }
}
