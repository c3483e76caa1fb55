package com.portLogistics.aiAssistant.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.portLogistics.aiAssistant.history.model.ConversationTurn;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for chat messages.
 *
 * Role and user id may also arrive as headers, which take precedence. A blank message is accepted
 * and answered as unknown; a missing one is rejected.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatRequest {

    @Size(max = 4000, message = "message must be at most 4000 characters")
    private String message;

    private String conversationId;

    /**
     * Inline history; when absent and a conversationId is given, history is fetched from the backend.
     */
    private List<ConversationTurn> history;

    private String userRole;

    private String userId;

    private Boolean forceDeterministic;

    @Pattern(regexp = "(?i)text|voice", message = "inputModality must be text or voice")
    private String inputModality;

    public boolean forceDeterministicRequested() {
        return Boolean.TRUE.equals(forceDeterministic);
    }
}
