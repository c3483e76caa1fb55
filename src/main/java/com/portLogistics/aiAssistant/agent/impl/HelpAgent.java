package com.portLogistics.aiAssistant.agent.impl;

import com.portLogistics.aiAssistant.access.service.AccessPolicy;
import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists what the caller's role can ask for.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HelpAgent extends BaseAgent {

    private static final Map<Intent, String> CAPABILITIES = new EnumMap<>(Intent.class);

    static {
        CAPABILITIES.put(Intent.BOOKING_STATUS, "Check a booking status (e.g. \"status of REF123\")");
        CAPABILITIES.put(Intent.BOOKING_CREATE, "Book a slot (e.g. \"book terminal A tomorrow\")");
        CAPABILITIES.put(Intent.SLOT_AVAILABILITY, "See available slots (e.g. \"availability at terminal A\")");
        CAPABILITIES.put(Intent.PASSAGE_HISTORY, "Review truck passages (e.g. \"yesterday's truck entries\")");
        CAPABILITIES.put(Intent.BLOCKCHAIN_AUDIT, "Verify a booking on the blockchain (e.g. \"prove REF123\")");
        CAPABILITIES.put(Intent.CARRIER_SCORE, "Look up a carrier's reliability score");
        CAPABILITIES.put(Intent.OPERATOR_ANALYTICS, "View terminal analytics and forecasts");
    }

    private final AccessPolicy accessPolicy;

    @Override
    public Intent intent() {
        return Intent.HELP;
    }

    @Override
    public AgentResponse run(AgentContext context) {
        Set<Intent> allowed = accessPolicy.allowedIntents(context.getRole());
        List<String> capabilities = new ArrayList<>();
        CAPABILITIES.forEach((intent, description) -> {
            if (allowed.contains(intent)) {
                capabilities.add(description);
            }
        });
        log.debug("Help requested - traceId: {}, capabilities: {}", context.getTraceId(), capabilities.size());

        StringBuilder message = new StringBuilder("I'm the port logistics assistant.");
        if (capabilities.isEmpty()) {
            message.append(" Sign in with a carrier or operator account to manage bookings and slots.");
        } else {
            message.append(" Here is what I can do for you:");
            capabilities.forEach(capability -> message.append("\n- ").append(capability));
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("capabilities", capabilities);
        return successResponse(message.toString(), data, context.getTraceId());
    }
}
