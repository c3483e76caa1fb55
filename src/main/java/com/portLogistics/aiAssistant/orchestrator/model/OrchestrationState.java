package com.portLogistics.aiAssistant.orchestrator.model;

import com.portLogistics.aiAssistant.access.model.AccessDecision;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.ExtractedEntities;
import com.portLogistics.aiAssistant.classification.model.IntentResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state carried through CLASSIFY, FOLLOWUP, AUTHORIZE, DISPATCH and RESPOND.
 * Created per request and discarded once the envelope is built.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrchestrationState {

    private OrchestrationRequest request;

    /**
     * Result of the classifier that was used, after follow-up resolution.
     */
    private IntentResult classification;

    /**
     * "llm" or "pattern".
     */
    private String classifier;

    private ExtractedEntities entities;

    private boolean followUpApplied;

    private AccessDecision accessDecision;

    /**
     * Label returned to the caller; usually the intent's wire name, or "forbidden" / "not_implemented".
     */
    private String responseIntent;

    private String agentName;

    private AgentResponse response;

    /**
     * Steps taken, in order (classifier used, fallbacks, follow-up, access, agent).
     */
    @Builder.Default
    private List<String> decisionPath = new ArrayList<>();

    public void step(String step) {
        decisionPath.add(step);
    }

    public String getTraceId() {
        return request != null ? request.getTraceId() : null;
    }
}
