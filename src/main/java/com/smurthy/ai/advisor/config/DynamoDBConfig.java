package com.smurthy.ai.advisor.config;

import com.smurthy.ai.advisor.agents.AgentRegistrySource;
import com.smurthy.ai.advisor.dynamodb.DynamoDBAgentRegistrySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URI;

/**
 * DynamoDB overlay for the agent registry.
 *
 * Configuration Properties (application.yml):
 * <pre>
 * app.registry.dynamodb.enabled=true
 * # DynamoDB Local endpoint; leave unset for AWS
 * app.registry.dynamodb.endpoint=http://localhost:8000
 * app.registry.dynamodb.table-name=agent_registry
 * </pre>
 *
 * The table is read-only from this service; it is provisioned and edited by operators.
 */
@Configuration
@ConditionalOnProperty(name = "app.registry.dynamodb.enabled", havingValue = "true", matchIfMissing = false)
public class DynamoDBConfig {

    private static final Logger log = LoggerFactory.getLogger(DynamoDBConfig.class);

    /**
     * For DynamoDB Local: fake credentials and local endpoint.
     * For AWS DynamoDB: leave the endpoint empty and use the default credential chain.
     */
    @Bean
    public DynamoDbClient dynamoDbClient(RegistryConfig registryConfig) {
        RegistryConfig.DynamoDb settings = registryConfig.dynamodb();
        log.info("Initializing DynamoDB client for agent registry table '{}'", settings.tableName());

        var clientBuilder = DynamoDbClient.builder()
                .region(Region.of(settings.region()));

        if (settings.endpoint() != null && !settings.endpoint().isEmpty()) {
            clientBuilder
                    .endpointOverride(URI.create(settings.endpoint()))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("fakeAccessKey", "fakeSecretKey")));
            log.info("Configured for DynamoDB Local at {}", settings.endpoint());
        } else {
            log.info("Configured for AWS DynamoDB in region {}", settings.region());
        }

        return clientBuilder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    @Bean
    public AgentRegistrySource dynamoDBAgentRegistrySource(DynamoDbEnhancedClient enhancedClient,
                                                           RegistryConfig registryConfig) {
        return new DynamoDBAgentRegistrySource(enhancedClient, registryConfig.dynamodb().tableName());
    }
}
