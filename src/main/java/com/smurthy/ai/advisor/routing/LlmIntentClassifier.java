package com.smurthy.ai.advisor.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.advisor.config.RoutingConfig;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import com.smurthy.ai.advisor.service.TextGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * LLM-based intent classifier.
 *
 * Asks the model for a single JSON object restricted to the known agent ids and validates the
 * answer against that schema. Anything outside the allowed label set is rejected, never passed
 * on as a routing target.
 */
@Component
public class LlmIntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmIntentClassifier.class);

    static final String NONE_LABEL = "none";

    private static final String CLASSIFICATION_PROMPT = """
            Tu es un classificateur de questions pour un systeme multi-agents.

            Analyse la question de l'utilisateur et identifie quel agent specialise doit y repondre.

            AGENTS DISPONIBLES :
            %s

            REGLES :
            1. Reponds UNIQUEMENT avec un objet JSON, sans texte autour :
               {"agent": "<identifiant>", "confidence": <nombre entre 0 et 1>, "reason": "<courte justification>"}
            2. "agent" doit etre exactement un des identifiants ci-dessus, ou "none" si la question
               ne releve d'aucun agent.
            3. "confidence" mesure ta certitude.

            QUESTION : %s
            """;

    private final TextGenerator textGenerator;
    private final ObjectMapper objectMapper;
    private final RoutingConfig config;

    public LlmIntentClassifier(TextGenerator textGenerator, ObjectMapper objectMapper, RoutingConfig config) {
        this.textGenerator = textGenerator;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    public ClassificationOutcome classify(String question, List<AgentDescriptor> agents) {
        if (agents.isEmpty()) {
            return ClassificationOutcome.abstained("no agents registered");
        }

        String catalog = agents.stream()
                .map(a -> "- " + a.id() + " : " + a.description())
                .collect(Collectors.joining("\n"));
        String prompt = String.format(CLASSIFICATION_PROMPT, catalog, question);

        String response;
        try {
            response = textGenerator.generate(prompt, config.classifierTemperature(), config.classifierMaxTokens());
        } catch (RuntimeException e) {
            log.warn("Classifier call failed, falling back to rules: {}", e.getMessage());
            return ClassificationOutcome.failed("classifier call failed: " + e.getMessage());
        }

        log.debug("Classifier raw response: {}", response);
        Set<String> knownIds = agents.stream().map(AgentDescriptor::id).collect(Collectors.toSet());
        return parse(response, knownIds);
    }

    /**
     * Validate a classifier response against the expected schema.
     */
    ClassificationOutcome parse(String response, Set<String> knownIds) {
        Optional<JsonNode> node = readObject(response);
        if (node.isEmpty()) {
            node = firstObjectSpan(response).flatMap(this::readObject);
        }
        if (node.isEmpty()) {
            log.warn("Classifier output is not JSON, ignoring it");
            return ClassificationOutcome.rejected("unparseable classifier output");
        }

        JsonNode json = node.get();
        JsonNode agentNode = json.get("agent");
        JsonNode confidenceNode = json.get("confidence");
        if (agentNode == null || !agentNode.isTextual()) {
            return ClassificationOutcome.rejected("classifier output has no 'agent' string");
        }
        String reason = json.path("reason").asText("");
        String agent = agentNode.asText().strip().toLowerCase(Locale.ROOT);

        if (NONE_LABEL.equals(agent)) {
            return ClassificationOutcome.abstained(reason);
        }
        if (!knownIds.contains(agent)) {
            log.warn("Classifier named unknown agent '{}', discarding it", agent);
            return ClassificationOutcome.rejected("unknown agent '" + agent + "'");
        }
        if (confidenceNode == null || !confidenceNode.isNumber()) {
            return ClassificationOutcome.rejected("classifier output has no numeric 'confidence'");
        }
        return ClassificationOutcome.classified(agent, confidenceNode.asDouble(), reason);
    }

    private Optional<JsonNode> readObject(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(text.strip());
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * The first balanced {@code {...}} span, skipping braces inside JSON strings.
     */
    static Optional<String> firstObjectSpan(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        if (start < 0) {
            return Optional.empty();
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(text.substring(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }
}
