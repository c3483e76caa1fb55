package com.portLogistics.aiAssistant.agent.impl;

import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.Intent;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class SmallTalkAgent extends BaseAgent {

    private static final Pattern FAREWELL = Pattern.compile("\\b(bye|goodbye|au revoir)\\b");
    private static final Pattern THANKS = Pattern.compile("\\b(thanks|thank you|merci|saha|shukran)\\b");

    @Override
    public Intent intent() {
        return Intent.SMALLTALK;
    }

    @Override
    public AgentResponse run(AgentContext context) {
        String text = context.getMessage() == null ? "" : context.getMessage().toLowerCase(Locale.ROOT);
        String reply;
        if (FAREWELL.matcher(text).find()) {
            reply = "Goodbye! Safe travels through the port.";
        } else if (THANKS.matcher(text).find()) {
            reply = "You're welcome! Anything else I can help with?";
        } else {
            reply = "I'm doing well, thanks. What can I do for you today?";
        }
        return successResponse(reply, Map.of(), context.getTraceId());
    }
}
