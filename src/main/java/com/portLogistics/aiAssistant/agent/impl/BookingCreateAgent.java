package com.portLogistics.aiAssistant.agent.impl;

import com.portLogistics.aiAssistant.agent.client.BackendServiceException;
import com.portLogistics.aiAssistant.agent.client.PortBackendClient;
import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.agent.service.BookingDateResolver;
import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import com.portLogistics.aiAssistant.classification.model.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Creates a booking for the signed-in carrier.
 *
 * Requires an auth token, a terminal and a date. Gate, slot id and carrier id are forwarded when present.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCreateAgent extends BaseAgent {

    private final PortBackendClient backendClient;
    private final BookingDateResolver dateResolver;

    @Override
    public Intent intent() {
        return Intent.BOOKING_CREATE;
    }

    @Override
    public AgentResponse run(AgentContext context) {
        String traceId = context.getTraceId();
        if (!context.hasAuthToken()) {
            log.info("Booking creation without auth token - traceId: {}", traceId);
            return authRequired(traceId);
        }

        ExtractedEntities entities = context.getEntities();
        String terminal = entities.getString(ExtractedEntities.TERMINAL);
        if (terminal == null) {
            return validationError(
                    "Which terminal would you like to book?",
                    "Mention the terminal, for example terminal A",
                    ExtractedEntities.TERMINAL,
                    "Book terminal A tomorrow",
                    traceId);
        }
        Optional<String> date = dateResolver.resolve(entities);
        if (date.isEmpty()) {
            return validationError(
                    "For which day should I book terminal " + terminal + "?",
                    "Add a date such as today, tomorrow or 2025-01-31",
                    "date",
                    "Book terminal " + terminal + " tomorrow",
                    traceId);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ExtractedEntities.TERMINAL, terminal);
        payload.put("date", date.get());
        copyIfPresent(entities, ExtractedEntities.GATE, payload);
        copyIfPresent(entities, ExtractedEntities.SLOT_ID, payload);
        copyIfPresent(entities, ExtractedEntities.CARRIER_ID, payload);

        try {
            Map<String, Object> booking = backendClient.createBooking(payload, context.getAuthToken(), traceId);
            Object reference = booking.getOrDefault("booking_ref", booking.get("id"));
            log.info("Booking created - traceId: {}, terminal: {}, date: {}, reference: {}",
                    traceId, terminal, date.get(), reference);

            Map<String, Object> data = new LinkedHashMap<>(payload);
            data.put("booking_ref", reference);
            data.put("booking", booking);
            String message = reference != null
                    ? "Your booking at terminal " + terminal + " on " + date.get() + " is confirmed (reference " + reference + ")."
                    : "Your booking at terminal " + terminal + " on " + date.get() + " is confirmed.";
            return successResponse(message, data, traceId);
        } catch (BackendServiceException e) {
            return backendError(e, "booking", traceId);
        }
    }

    private static void copyIfPresent(ExtractedEntities entities, String key, Map<String, Object> payload) {
        String value = entities.getString(key);
        if (value != null) {
            payload.put(key, value);
        }
    }
}
