package com.smurthy.ai.advisor.controllers;

import com.smurthy.ai.advisor.agents.AgentRegistry;
import com.smurthy.ai.advisor.retrieval.DocumentCorpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator endpoints to refresh cached state without a restart.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final DocumentCorpus documentCorpus;
    private final AgentRegistry agentRegistry;

    public AdminController(DocumentCorpus documentCorpus, AgentRegistry agentRegistry) {
        this.documentCorpus = documentCorpus;
        this.agentRegistry = agentRegistry;
    }

    @PostMapping("/corpus/refresh")
    public Map<String, Object> refreshCorpus() {
        int documents = documentCorpus.refresh().size();
        log.info("Corpus refresh requested: {} document(s) now served", documents);

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("documents", documents);
        status.put("loadedAt", documentCorpus.lastLoadedAt().map(Object::toString).orElse(null));
        return status;
    }

    @PostMapping("/registry/reload")
    public Map<String, Object> reloadRegistry() {
        int agents = agentRegistry.reload();
        log.info("Registry reload requested: {} agent(s)", agents);
        return Map.of("agents", agents);
    }
}
