package com.smurthy.ai.advisor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.orchestrator")
public record OrchestratorConfig(
        @DefaultValue("90s") Duration requestTimeout
) {
}
