package com.smurthy.ai.advisor.model;

import java.util.List;

/**
 * Registry entry for a downstream responder. Static for the lifetime of a registry snapshot.
 */
public record AgentDescriptor(
        String id,
        String endpointUrl,
        boolean requiresAuth,
        boolean needsExtraContext,
        boolean enabled,
        RequestFormat requestFormat,
        String description,
        List<String> keywords
) {
    public AgentDescriptor {
        requestFormat = requestFormat == null ? RequestFormat.QUESTION : requestFormat;
        description = description == null ? "" : description;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    /**
     * An agent can be called only when it is enabled and has somewhere to send the request.
     */
    public boolean isCallable() {
        return enabled && endpointUrl != null && !endpointUrl.isBlank();
    }
}
