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
import java.util.List;
import java.util.Map;

/**
 * Reports open slots for a terminal. Without a date in the message it looks at today.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotAvailabilityAgent extends BaseAgent {

    private final PortBackendClient backendClient;
    private final BookingDateResolver dateResolver;

    @Override
    public Intent intent() {
        return Intent.SLOT_AVAILABILITY;
    }

    @Override
    public AgentResponse run(AgentContext context) {
        String traceId = context.getTraceId();
        ExtractedEntities entities = context.getEntities();
        String terminal = entities.getString(ExtractedEntities.TERMINAL);
        if (terminal == null) {
            return validationError(
                    "Which terminal are you interested in?",
                    "Mention the terminal, for example terminal A",
                    ExtractedEntities.TERMINAL,
                    "Are there available slots tomorrow at terminal A?",
                    traceId);
        }
        String date = dateResolver.resolveOrToday(entities);
        String gate = entities.getString(ExtractedEntities.GATE);

        try {
            Map<String, Object> availability = backendClient.getSlotAvailability(
                    terminal, date, gate, context.getAuthToken(), traceId);
            Object rawSlots = availability.get("slots");
            List<?> slots = rawSlots instanceof List ? (List<?>) rawSlots : List.of();
            log.info("Availability retrieved - traceId: {}, terminal: {}, date: {}, slots: {}",
                    traceId, terminal, date, slots.size());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("terminal", terminal);
            data.put("date", date);
            if (gate != null) {
                data.put("gate", gate);
            }
            data.put("slots", slots);
            String message = slots.isEmpty()
                    ? "No open slots at terminal " + terminal + " on " + date + "."
                    : slots.size() + " open slot(s) at terminal " + terminal + " on " + date + ".";
            return successResponse(message, data, traceId);
        } catch (BackendServiceException e) {
            return backendError(e, "availability information", traceId);
        }
    }
}
