package com.portLogistics.aiAssistant.agent.impl;

import com.portLogistics.aiAssistant.agent.client.BackendServiceException;
import com.portLogistics.aiAssistant.agent.model.Agent;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared envelope helpers for the built-in agents.
 */
public abstract class BaseAgent implements Agent {

    public static final String ERROR_TYPE_VALIDATION = "ValidationError";
    public static final String ERROR_TYPE_AUTH_REQUIRED = "AuthRequired";
    public static final String ERROR_TYPE_BACKEND = "BackendError";

    protected AgentResponse successResponse(String message, Map<String, Object> data, String traceId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(AgentResponse.DATA_ERROR, false);
        if (data != null) {
            data.forEach(payload::putIfAbsent);
        }
        Map<String, Object> proofs = new LinkedHashMap<>();
        proofs.put(AgentResponse.PROOF_TRACE_ID, traceId);
        return AgentResponse.builder()
                .message(message)
                .data(payload)
                .proofs(proofs)
                .build();
    }

    protected AgentResponse errorResponse(String message, String traceId, String errorType, Map<String, Object> extras) {
        return AgentResponse.error(message, errorType, traceId, extras);
    }

    /**
     * Error envelope for a request that lacks a required field.
     *
     * @param message      User-facing message
     * @param suggestion   What the user should add
     * @param missingField Entity name that was missing
     * @param example      Example message that would succeed
     * @param traceId      Trace id
     * @return Validation error envelope
     */
    protected AgentResponse validationError(String message, String suggestion, String missingField,
                                            String example, String traceId) {
        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("missing_field", missingField);
        extras.put("suggestion", suggestion);
        if (example != null) {
            extras.put("example", example);
        }
        return AgentResponse.error(message, ERROR_TYPE_VALIDATION, traceId, extras);
    }

    protected AgentResponse authRequired(String traceId) {
        return AgentResponse.error("You need to be signed in to do that. Please log in and try again.",
                ERROR_TYPE_AUTH_REQUIRED, traceId, Map.of());
    }

    /**
     * Maps a backend failure to a safe user-facing envelope. The backend's own message is never shown.
     */
    protected AgentResponse backendError(BackendServiceException e, String subject, String traceId) {
        int status = e.getStatusCode();
        String message;
        if (status == 401) {
            message = "Your session has expired or you are not signed in. Please log in again.";
        } else if (status == 403) {
            message = "You don't have permission to access this " + subject + ".";
        } else if (status == 404) {
            message = "I couldn't find that " + subject + ". Please check the reference and try again.";
        } else if (status == 422 || status == 400) {
            message = "The " + subject + " details are invalid. Please check them and try again.";
        } else {
            message = "The port service is temporarily unavailable. Please try again in a moment.";
        }
        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("status_code", status);
        return AgentResponse.error(message, ERROR_TYPE_BACKEND, traceId, extras);
    }
}
