package com.smurthy.ai.advisor.exceptions;

public class AgentUnreachableException extends AdvisorException {

    private final String agentId;
    private final int attempts;

    public AgentUnreachableException(String agentId, int attempts, Throwable cause) {
        super(ErrorKind.AGENT_UNREACHABLE,
                "Agent '" + agentId + "' unreachable after " + attempts + " attempt(s)", cause);
        this.agentId = agentId;
        this.attempts = attempts;
    }

    public String getAgentId() {
        return agentId;
    }

    public int getAttempts() {
        return attempts;
    }
}
