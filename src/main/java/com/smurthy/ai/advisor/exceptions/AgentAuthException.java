package com.smurthy.ai.advisor.exceptions;

/**
 * The target agent rejected the call (401/403), or no credential is configured for an agent
 * that requires one. Never retried.
 */
public class AgentAuthException extends AdvisorException {

    private final String agentId;
    private final int statusCode;

    public AgentAuthException(String agentId, int statusCode, String message) {
        super(ErrorKind.AGENT_AUTH, message);
        this.agentId = agentId;
        this.statusCode = statusCode;
    }

    public String getAgentId() {
        return agentId;
    }

    /**
     * HTTP status returned by the agent, or 0 when the call was refused locally.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
