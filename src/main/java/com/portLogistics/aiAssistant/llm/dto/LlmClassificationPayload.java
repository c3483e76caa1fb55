package com.portLogistics.aiAssistant.llm.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * JSON object the classification prompt asks the model to return.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlmClassificationPayload {

    @JsonProperty("intent")
    private String intent;

    @JsonProperty("entities")
    private Map<String, Object> entities;

    @JsonProperty("confidence")
    private Double confidence;
}
