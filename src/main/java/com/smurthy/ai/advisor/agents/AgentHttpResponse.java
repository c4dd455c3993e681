package com.smurthy.ai.advisor.agents;

/**
 * Status and raw body of a completed agent call.
 */
public record AgentHttpResponse(int statusCode, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
