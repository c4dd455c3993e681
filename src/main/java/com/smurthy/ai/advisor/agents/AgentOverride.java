package com.smurthy.ai.advisor.agents;

import com.smurthy.ai.advisor.model.AgentDescriptor;
import com.smurthy.ai.advisor.model.RequestFormat;

import java.util.List;

/**
 * Partial agent definition read from an external registry collection.
 * Null fields leave the default untouched.
 */
public record AgentOverride(
        String id,
        String endpointUrl,
        Boolean requiresAuth,
        Boolean needsExtraContext,
        Boolean enabled,
        RequestFormat requestFormat,
        String description,
        List<String> keywords
) {

    public AgentDescriptor applyTo(AgentDescriptor base) {
        return new AgentDescriptor(
                base.id(),
                endpointUrl != null ? endpointUrl : base.endpointUrl(),
                requiresAuth != null ? requiresAuth : base.requiresAuth(),
                needsExtraContext != null ? needsExtraContext : base.needsExtraContext(),
                enabled != null ? enabled : base.enabled(),
                requestFormat != null ? requestFormat : base.requestFormat(),
                description != null ? description : base.description(),
                keywords != null ? keywords : base.keywords());
    }

    /**
     * Descriptor for an agent that has no static default.
     */
    public AgentDescriptor toDescriptor() {
        return applyTo(new AgentDescriptor(id, null, false, false, true, RequestFormat.QUESTION, "", List.of()));
    }
}
