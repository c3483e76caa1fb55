package com.portLogistics.aiAssistant.agent.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform response envelope returned by every agent.
 *
 * {@code data} always carries an {@code error} flag once the envelope has passed the dispatcher,
 * and {@code proofs} always carries the {@code trace_id}.
 */
@Value
@Builder(toBuilder = true)
public class AgentResponse {

    public static final String DATA_ERROR = "error";
    public static final String DATA_ERROR_TYPE = "error_type";
    public static final String PROOF_TRACE_ID = "trace_id";

    String message;

    Map<String, Object> data;

    Map<String, Object> proofs;

    public boolean isError() {
        return data != null && Boolean.TRUE.equals(data.get(DATA_ERROR));
    }

    public String getErrorType() {
        Object errorType = data != null ? data.get(DATA_ERROR_TYPE) : null;
        return errorType != null ? errorType.toString() : null;
    }

    /**
     * Builds a structured error envelope.
     *
     * @param message   User-facing message
     * @param errorType Machine-readable error tag
     * @param traceId   Request trace id
     * @param extra     Additional data fields (may be empty)
     * @return Error envelope
     */
    public static AgentResponse error(String message, String errorType, String traceId, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(DATA_ERROR, true);
        data.put(DATA_ERROR_TYPE, errorType);
        if (extra != null) {
            extra.forEach(data::putIfAbsent);
        }
        Map<String, Object> proofs = new LinkedHashMap<>();
        proofs.put(PROOF_TRACE_ID, traceId);
        return AgentResponse.builder()
                .message(message)
                .data(data)
                .proofs(proofs)
                .build();
    }
}
