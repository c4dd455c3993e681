package com.smurthy.ai.advisor.agents;

import com.smurthy.ai.advisor.config.RegistryConfig;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Agents the orchestrator can route to.
 *
 * Static defaults come from {@code app.registry.agents}. When an {@link AgentRegistrySource} is
 * configured its entries override the defaults field by field; an entry for an unknown id is
 * added only if it names an endpoint. Loaded lazily once, replaced wholesale on {@link #reload()}.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final RegistryConfig config;
    private final AgentRegistrySource source;
    private final ReentrantLock loadLock = new ReentrantLock();

    private volatile Map<String, AgentDescriptor> agents;

    @Autowired
    public AgentRegistry(RegistryConfig config, ObjectProvider<AgentRegistrySource> source) {
        this(config, source.getIfAvailable());
    }

    AgentRegistry(RegistryConfig config, AgentRegistrySource source) {
        this.config = config;
        this.source = source;
    }

    /**
     * All registered agents, in configuration order.
     */
    public List<AgentDescriptor> all() {
        return List.copyOf(snapshot().values());
    }

    public Optional<AgentDescriptor> find(String agentId) {
        return Optional.ofNullable(snapshot().get(agentId));
    }

    public int reload() {
        loadLock.lock();
        try {
            agents = build();
            return agents.size();
        } finally {
            loadLock.unlock();
        }
    }

    private Map<String, AgentDescriptor> snapshot() {
        Map<String, AgentDescriptor> current = agents;
        if (current != null) {
            return current;
        }
        loadLock.lock();
        try {
            if (agents == null) {
                agents = build();
            }
            return agents;
        } finally {
            loadLock.unlock();
        }
    }

    private Map<String, AgentDescriptor> build() {
        Map<String, AgentDescriptor> merged = new LinkedHashMap<>();
        config.agents().forEach((id, props) -> merged.put(id, new AgentDescriptor(
                id,
                props.endpointUrl(),
                props.requiresAuth(),
                props.needsExtraContext(),
                props.enabled(),
                props.requestFormat(),
                props.description(),
                props.keywords())));

        if (source != null) {
            try {
                List<AgentOverride> overrides = source.loadOverrides();
                for (AgentOverride override : overrides) {
                    AgentDescriptor base = merged.get(override.id());
                    if (base != null) {
                        merged.put(override.id(), override.applyTo(base));
                    } else if (override.endpointUrl() != null && !override.endpointUrl().isBlank()) {
                        merged.put(override.id(), override.toDescriptor());
                    } else {
                        log.warn("Ignoring registry entry '{}' from {}: unknown agent without endpoint",
                                override.id(), source.describe());
                    }
                }
                log.info("Applied {} registry override(s) from {}", overrides.size(), source.describe());
            } catch (RuntimeException e) {
                log.warn("Could not read agent registry from {}, using defaults: {}", source.describe(), e.getMessage());
            }
        }

        log.info("Agent registry loaded: {}", merged.keySet());
        return Collections.unmodifiableMap(merged);
    }
}
