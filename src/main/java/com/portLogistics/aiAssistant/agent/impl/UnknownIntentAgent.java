package com.portLogistics.aiAssistant.agent.impl;

import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.Intent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fallback reply when the message could not be classified.
 */
@Component
public class UnknownIntentAgent extends BaseAgent {

    private static final List<String> SUGGESTIONS = List.of(
            "What's the status of REF123?",
            "Are there available slots tomorrow at terminal A?",
            "Book terminal A tomorrow");

    @Override
    public Intent intent() {
        return Intent.UNKNOWN;
    }

    @Override
    public AgentResponse run(AgentContext context) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("suggestions", SUGGESTIONS);
        return successResponse(
                "I didn't understand your request. Try rephrasing it, or type \"help\" to see what I can do.",
                data,
                context.getTraceId());
    }
}
