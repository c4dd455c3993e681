package com.smurthy.ai.advisor;

import com.smurthy.ai.advisor.config.CorpusConfig;
import com.smurthy.ai.advisor.config.EmbeddingConfig;
import com.smurthy.ai.advisor.config.InvokerConfig;
import com.smurthy.ai.advisor.config.OrchestratorConfig;
import com.smurthy.ai.advisor.config.RegistryConfig;
import com.smurthy.ai.advisor.config.ResponderConfig;
import com.smurthy.ai.advisor.config.RetrievalConfig;
import com.smurthy.ai.advisor.config.RoutingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CorpusConfig.class,
        EmbeddingConfig.class,
        InvokerConfig.class,
        OrchestratorConfig.class,
        RegistryConfig.class,
        ResponderConfig.class,
        RetrievalConfig.class,
        RoutingConfig.class
})
public class AdvisorRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdvisorRouterApplication.class, args);
    }
}
