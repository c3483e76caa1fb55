package com.portLogistics.aiAssistant.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Non-secret view of the classifier configuration. The API key itself is never exposed.
 */
@Value
@Builder
public class ClassifierConfigResponse {

    @JsonProperty("llm_enabled")
    boolean llmEnabled;

    @JsonProperty("llm_configured")
    boolean llmConfigured;

    @JsonProperty("provider")
    String provider;

    @JsonProperty("model")
    String model;

    @JsonProperty("has_api_key")
    boolean hasApiKey;

    @JsonProperty("timeout_seconds")
    double timeoutSeconds;

    @JsonProperty("confidence_threshold")
    double confidenceThreshold;

    @JsonProperty("history_limit")
    int historyLimit;

    @JsonProperty("follow_up_window")
    int followUpWindow;
}
