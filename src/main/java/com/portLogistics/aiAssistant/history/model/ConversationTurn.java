package com.portLogistics.aiAssistant.history.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One prior turn of a conversation.
 * Unknown fields sent by the history provider are ignored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationTurn {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    /**
     * "user" or "assistant" once normalized; providers may send other values (e.g. "SYSTEM").
     */
    @JsonProperty("role")
    private String role;

    @JsonProperty("content")
    @JsonAlias("message")
    private String content;

    /**
     * Intent resolved for this turn, when the provider recorded one.
     */
    @JsonProperty("intent")
    private String intent;

    @JsonProperty("metadata")
    private Map<String, Object> metadata;

    public static ConversationTurn user(String content, String intent) {
        return ConversationTurn.builder().role(ROLE_USER).content(content).intent(intent).build();
    }

    public static ConversationTurn assistant(String content, String intent, Map<String, Object> metadata) {
        return ConversationTurn.builder().role(ROLE_ASSISTANT).content(content).intent(intent).metadata(metadata).build();
    }
}
