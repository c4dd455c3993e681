package com.smurthy.ai.advisor.dynamodb;

import com.smurthy.ai.advisor.agents.AgentOverride;
import com.smurthy.ai.advisor.agents.AgentRegistrySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.util.List;

/**
 * Agent registry overrides stored in a DynamoDB table, one item per agent.
 */
public class DynamoDBAgentRegistrySource implements AgentRegistrySource {

    private static final Logger log = LoggerFactory.getLogger(DynamoDBAgentRegistrySource.class);

    private final DynamoDbTable<AgentRegistryEntity> table;
    private final String tableName;

    public DynamoDBAgentRegistrySource(DynamoDbEnhancedClient enhancedClient, String tableName) {
        this.table = enhancedClient.table(tableName, TableSchema.fromBean(AgentRegistryEntity.class));
        this.tableName = tableName;
        log.info("DynamoDBAgentRegistrySource initialized with table '{}'", tableName);
    }

    @Override
    public List<AgentOverride> loadOverrides() {
        List<AgentOverride> overrides = table.scan().items().stream()
                .filter(entity -> entity.getAgentId() != null && !entity.getAgentId().isBlank())
                .map(AgentRegistryEntity::toOverride)
                .toList();
        log.debug("Read {} agent entries from DynamoDB table '{}'", overrides.size(), tableName);
        return overrides;
    }

    @Override
    public String describe() {
        return "dynamodb:" + tableName;
    }
}
