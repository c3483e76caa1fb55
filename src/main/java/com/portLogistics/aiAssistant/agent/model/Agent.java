package com.portLogistics.aiAssistant.agent.model;

import com.portLogistics.aiAssistant.classification.model.Intent;

/**
 * A handler for one intent.
 *
 * Expected failure modes (missing authentication, missing required entity, backend 4xx/5xx) must be
 * reported as error envelopes rather than thrown. Anything thrown anyway is caught by the dispatcher.
 */
public interface Agent {

    /**
     * @return Intent this agent handles; registration rejects two agents for the same intent
     */
    Intent intent();

    AgentResponse run(AgentContext context);
}
