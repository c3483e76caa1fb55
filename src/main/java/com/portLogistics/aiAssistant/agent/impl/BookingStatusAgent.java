package com.portLogistics.aiAssistant.agent.impl;

import com.portLogistics.aiAssistant.agent.client.BackendServiceException;
import com.portLogistics.aiAssistant.agent.client.PortBackendClient;
import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import com.portLogistics.aiAssistant.classification.model.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class BookingStatusAgent extends BaseAgent {

    private final PortBackendClient backendClient;

    @Override
    public Intent intent() {
        return Intent.BOOKING_STATUS;
    }

    @Override
    public AgentResponse run(AgentContext context) {
        String traceId = context.getTraceId();
        String bookingRef = context.getEntities().getString(ExtractedEntities.BOOKING_REF);
        if (bookingRef == null) {
            return validationError(
                    "Which booking should I look up? Please give me the booking reference.",
                    "Include the booking reference in your message",
                    ExtractedEntities.BOOKING_REF,
                    "What's the status of REF123?",
                    traceId);
        }

        try {
            Map<String, Object> booking = backendClient.getBooking(bookingRef, context.getAuthToken(), traceId);
            Object status = booking.getOrDefault("status", "unknown");
            log.info("Booking status retrieved - traceId: {}, bookingRef: {}, status: {}", traceId, bookingRef, status);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("booking_ref", bookingRef);
            data.put("status", status);
            data.put("booking", booking);
            return successResponse("Booking REF" + bookingRef + " is currently " + status + ".", data, traceId);
        } catch (BackendServiceException e) {
            return backendError(e, "booking", traceId);
        }
    }
}
