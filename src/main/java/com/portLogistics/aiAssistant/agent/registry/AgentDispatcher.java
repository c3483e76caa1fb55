package com.portLogistics.aiAssistant.agent.registry;

import com.portLogistics.aiAssistant.agent.model.Agent;
import com.portLogistics.aiAssistant.agent.model.AgentContext;
import com.portLogistics.aiAssistant.agent.model.AgentResponse;
import com.portLogistics.aiAssistant.classification.model.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the agent registered for an intent and guarantees an envelope comes back.
 *
 * No handler gives a "not_implemented" envelope; anything an agent throws gives a generic error
 * envelope tagged with the exception type. The dispatcher adds no timeout of its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentDispatcher {

    public static final String ERROR_TYPE_NOT_IMPLEMENTED = "NotImplemented";

    private final AgentRegistry agentRegistry;

    /**
     * @param intent  Authorized intent
     * @param context Agent context
     * @return Result of the dispatch, never null
     */
    public DispatchResult dispatch(Intent intent, AgentContext context) {
        String traceId = context.getTraceId();
        Optional<Agent> agent = agentRegistry.find(intent);
        if (agent.isEmpty()) {
            log.info("No agent registered - traceId: {}, intent: {}", traceId, intent);
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("requested_intent", intent != null ? intent.getWireName() : null);
            AgentResponse response = AgentResponse.error(
                    "This feature is not available yet. Type \"help\" to see what I can do for you.",
                    ERROR_TYPE_NOT_IMPLEMENTED, traceId, extra);
            return new DispatchResult(response, null, false);
        }

        String agentName = agent.get().getClass().getSimpleName();
        log.debug("Dispatching - traceId: {}, intent: {}, agent: {}", traceId, intent, agentName);
        AgentResponse response;
        try {
            response = agent.get().run(context);
        } catch (Exception e) {
            log.error("Agent failed - traceId: {}, agent: {}, error: {}", traceId, agentName, e.getMessage(), e);
            response = AgentResponse.error(
                    "Sorry, something went wrong while handling your request. Please try again.",
                    e.getClass().getSimpleName(), traceId, Map.of());
            return new DispatchResult(response, agentName, true);
        }

        if (response == null) {
            log.error("Agent returned no response - traceId: {}, agent: {}", traceId, agentName);
            response = AgentResponse.error(
                    "Sorry, something went wrong while handling your request. Please try again.",
                    "EmptyAgentResponse", traceId, Map.of());
            return new DispatchResult(response, agentName, true);
        }
        return new DispatchResult(normalize(response, traceId), agentName, true);
    }

    private static AgentResponse normalize(AgentResponse response, String traceId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(AgentResponse.DATA_ERROR, false);
        if (response.getData() != null) {
            data.putAll(response.getData());
        }
        if (data.get(AgentResponse.DATA_ERROR) == null) {
            data.put(AgentResponse.DATA_ERROR, false);
        }
        Map<String, Object> proofs = new LinkedHashMap<>();
        if (response.getProofs() != null) {
            proofs.putAll(response.getProofs());
        }
        if (proofs.get(AgentResponse.PROOF_TRACE_ID) == null) {
            proofs.put(AgentResponse.PROOF_TRACE_ID, traceId);
        }
        return response.toBuilder()
                .message(response.getMessage() != null ? response.getMessage() : "")
                .data(data)
                .proofs(proofs)
                .build();
    }

    /**
     * @param response  Envelope to return
     * @param agentName Simple class name of the agent that ran, or null when none was registered
     * @param handled   Whether a registered agent was invoked
     */
    public record DispatchResult(AgentResponse response, String agentName, boolean handled) {
    }
}
