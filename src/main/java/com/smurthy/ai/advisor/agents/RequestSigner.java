package com.smurthy.ai.advisor.agents;

import com.smurthy.ai.advisor.exceptions.AgentAuthException;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import org.springframework.http.HttpHeaders;

/**
 * Adds credentials to an outbound call for agents that require authentication.
 */
public interface RequestSigner {

    /**
     * @throws AgentAuthException when no credential can be produced for {@code agent}
     */
    void sign(HttpHeaders headers, AgentDescriptor agent);
}
