package com.portLogistics.aiAssistant.orchestrator.model;

import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Typed inputs of one message handled by the orchestrator.
 */
@Value
@Builder
public class OrchestrationRequest {

    String message;

    /**
     * Normalized history, most recent last.
     */
    @Builder.Default
    List<ConversationTurn> history = List.of();

    String role;

    String userId;

    String traceId;

    /**
     * Authorization header value forwarded to agents, or null.
     */
    String authToken;

    /**
     * Skips the LLM classifier for this request.
     */
    boolean forceDeterministic;

    /**
     * "text" or "voice"; informational only.
     */
    String inputModality;
}
