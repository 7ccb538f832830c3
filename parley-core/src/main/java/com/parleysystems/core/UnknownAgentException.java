package com.parleysystems.core;

import com.parleysystems.message.AgentId;

/**
 * Thrown (or reported in a failed {@link Result}) when a message targets an agent
 * that is not registered with the router.
 */
public class UnknownAgentException extends MessagingException {

    private final AgentId agentId;

    public UnknownAgentException(AgentId agentId) {
        super(ErrorKind.UNKNOWN_AGENT, "Agent not registered: " + agentId);
        this.agentId = agentId;
    }

    public UnknownAgentException(AgentId agentId, Throwable cause) {
        super(ErrorKind.UNKNOWN_AGENT, "Agent not registered: " + agentId, cause);
        this.agentId = agentId;
    }

    /**
     * Returns the agent that could not be found.
     *
     * @return the unknown agent id
     */
    public AgentId getAgentId() {
        return agentId;
    }
}
