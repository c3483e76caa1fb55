package com.portLogistics.aiAssistant.orchestrator.model;

import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.IntentResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the orchestrator hands back to the transport layer.
 */
@Value
@Builder
public class OrchestrationResult {

    /**
     * Intent wire name, or "forbidden" / "not_implemented".
     */
    String intent;

    /**
     * Classification as finally resolved; null only if classification itself failed.
     */
    IntentResult classification;

    AgentResponse response;

    List<String> decisionPath;
}
