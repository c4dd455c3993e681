package com.smurthy.ai.advisor.config;

import com.smurthy.ai.advisor.model.RequestFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * Agent registry defaults ({@code app.registry.agents.<id>}) plus the optional DynamoDB overlay.
 *
 * Example:
 * <pre>
 * app.registry.agents.fiscalite.endpoint-url=http://localhost:8080/agents/fiscal
 * app.registry.agents.fiscalite.keywords=tva,impot,cfe
 * app.registry.dynamodb.enabled=true
 * app.registry.dynamodb.table-name=agent_registry
 * </pre>
 */
@ConfigurationProperties(prefix = "app.registry")
public record RegistryConfig(
        Map<String, AgentProperties> agents,
        @DefaultValue DynamoDb dynamodb
) {
    public RegistryConfig {
        agents = agents == null ? Map.of() : agents;
    }

    public record AgentProperties(
            String endpointUrl,
            @DefaultValue("false") boolean requiresAuth,
            @DefaultValue("false") boolean needsExtraContext,
            @DefaultValue("true") boolean enabled,
            @DefaultValue("QUESTION") RequestFormat requestFormat,
            String description,
            List<String> keywords
    ) {
    }

    public record DynamoDb(
            @DefaultValue("false") boolean enabled,
            String endpoint,
            @DefaultValue("eu-west-3") String region,
            @DefaultValue("agent_registry") String tableName
    ) {
    }
}
