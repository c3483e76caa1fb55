package com.portLogistics.aiAssistant.history.service;

import com.portLogistics.aiAssistant.history.model.ConversationTurn;

import java.util.List;

/**
 * Narrow interface to the externally owned conversation store.
 *
 * Implementations never throw: a failed fetch yields an empty history and a failed append is dropped.
 */
public interface ConversationHistoryClient {

    /**
     * @param conversationId Conversation id
     * @param authToken      Authorization header value, may be null
     * @param traceId        Trace id
     * @return Turns oldest first, possibly empty
     */
    List<ConversationTurn> fetchHistory(String conversationId, String authToken, String traceId);

    void appendTurn(String conversationId, ConversationTurn turn, String authToken, String traceId);
}
