package com.smurthy.ai.advisor.controllers;

import com.smurthy.ai.advisor.dto.ResponderAnswer;
import com.smurthy.ai.advisor.service.KnowledgeResponder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP contract of the co-hosted fiscal responder. The orchestrator reaches it like any other agent.
 */
@RestController
@RequestMapping("/agents")
public class ResponderController {

    private static final Logger log = LoggerFactory.getLogger(ResponderController.class);

    private final KnowledgeResponder knowledgeResponder;

    public ResponderController(KnowledgeResponder knowledgeResponder) {
        this.knowledgeResponder = knowledgeResponder;
    }

    @PostMapping("/fiscal")
    public ResponseEntity<?> fiscal(@RequestBody(required = false) Map<String, Object> request) {
        Object question = request == null ? null : request.get("question");
        if (!(question instanceof String text) || text.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "erreur", "Aucune question fournie. Utilisez le format: {\"question\": \"votre question\"}"));
        }

        try {
            ResponderAnswer answer = knowledgeResponder.answer(text);
            return ResponseEntity.ok(answer);
        } catch (RuntimeException e) {
            log.error("Answer generation failed for '{}'", text, e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "erreur", "Erreur lors de la génération de la réponse.",
                    "details", String.valueOf(e.getMessage())));
        }
    }
}
