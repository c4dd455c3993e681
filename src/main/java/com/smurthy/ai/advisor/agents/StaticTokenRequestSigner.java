package com.smurthy.ai.advisor.agents;

import com.smurthy.ai.advisor.exceptions.AgentAuthException;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import org.springframework.http.HttpHeaders;

/**
 * Signs calls with a bearer token from configuration ({@code app.invoker.auth-token}).
 */
public class StaticTokenRequestSigner implements RequestSigner {

    private final String token;

    public StaticTokenRequestSigner(String token) {
        this.token = token;
    }

    @Override
    public void sign(HttpHeaders headers, AgentDescriptor agent) {
        if (token == null || token.isBlank()) {
            throw new AgentAuthException(agent.id(), 0,
                    "Agent '" + agent.id() + "' requires authentication but no credential is configured");
        }
        headers.setBearerAuth(token);
    }
}
