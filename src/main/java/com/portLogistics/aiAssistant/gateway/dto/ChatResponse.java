package com.portLogistics.aiAssistant.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response DTO for chat messages: the agent envelope plus the resolved intent label.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatResponse {

    /**
     * Intent wire name, or "forbidden" / "not_implemented".
     */
    private String intent;

    private String message;

    /**
     * Always carries {@code error}; error envelopes also carry {@code error_type}.
     */
    private Map<String, Object> data;

    /**
     * Always carries {@code trace_id} and {@code decision_path}.
     */
    private Map<String, Object> proofs;
}
