package com.smurthy.ai.advisor.dynamodb;

import com.smurthy.ai.advisor.agents.AgentOverride;
import com.smurthy.ai.advisor.model.RequestFormat;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.util.Arrays;
import java.util.List;

/**
 * DynamoDB entity for one agent registry entry.
 *
 * Table Design:
 * - Partition Key: agentId
 * - Every other attribute is optional; a missing attribute keeps the configured default.
 *
 * Example DynamoDB Item:
 * {
 *   "agentId": "juridique",
 *   "endpointUrl": "https://agent-juridique.example.run.app/query",
 *   "requiresAuth": true,
 *   "requestFormat": "USER_QUERY",
 *   "keywords": ["contrat", "rgpd", "statuts"]
 * }
 */
@DynamoDbBean
public class AgentRegistryEntity {

    private String agentId;
    private String endpointUrl;
    private Boolean requiresAuth;
    private Boolean needsExtraContext;
    private Boolean enabled;
    private String requestFormat;  // "QUESTION" or "USER_QUERY"
    private String description;
    private List<String> keywords;

    // Default constructor (required by DynamoDB Enhanced Client)
    public AgentRegistryEntity() {
    }

    @DynamoDbPartitionKey
    public String getAgentId() {
        return agentId;
    }

    public void setAgentId(String agentId) {
        this.agentId = agentId;
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    public void setEndpointUrl(String endpointUrl) {
        this.endpointUrl = endpointUrl;
    }

    public Boolean getRequiresAuth() {
        return requiresAuth;
    }

    public void setRequiresAuth(Boolean requiresAuth) {
        this.requiresAuth = requiresAuth;
    }

    public Boolean getNeedsExtraContext() {
        return needsExtraContext;
    }

    public void setNeedsExtraContext(Boolean needsExtraContext) {
        this.needsExtraContext = needsExtraContext;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }

    public String getRequestFormat() {
        return requestFormat;
    }

    public void setRequestFormat(String requestFormat) {
        this.requestFormat = requestFormat;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }

    /**
     * Convert to the registry's override model. An unrecognised request format is ignored.
     */
    public AgentOverride toOverride() {
        RequestFormat format = requestFormat == null ? null : Arrays.stream(RequestFormat.values())
                .filter(f -> f.name().equalsIgnoreCase(requestFormat.trim()))
                .findFirst()
                .orElse(null);
        return new AgentOverride(agentId, endpointUrl, requiresAuth, needsExtraContext, enabled,
                format, description, keywords);
    }
}
