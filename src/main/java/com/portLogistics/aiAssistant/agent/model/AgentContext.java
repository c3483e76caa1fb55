package com.portLogistics.aiAssistant.agent.model;

import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import com.portLogistics.aiAssistant.classification.model.Intent;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything an agent receives for one request.
 */
@Value
@Builder
public class AgentContext {

    String message;

    /**
     * Intent the request was dispatched under.
     */
    Intent intent;

    ExtractedEntities entities;

    /**
     * Normalized history, most recent last.
     */
    List<ConversationTurn> history;

    /**
     * Role as sent by the caller; agents normalize it when they need to.
     */
    String role;

    String userId;

    String traceId;

    /**
     * Authorization header value to forward to backend services, or null when unauthenticated.
     */
    String authToken;

    public boolean hasAuthToken() {
        return authToken != null && !authToken.isBlank();
    }
}
