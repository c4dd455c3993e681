package com.smurthy.ai.advisor.controllers;

import com.smurthy.ai.advisor.dto.AnswerEnvelope;
import com.smurthy.ai.advisor.dto.AskRequest;
import com.smurthy.ai.advisor.exceptions.ErrorKind;
import com.smurthy.ai.advisor.orchestration.OrchestrationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Orchestrator entry point. Every routed outcome, including agent failures, is a 200 with the
 * status in the envelope; only a missing question is a 400.
 */
@RestController
@RequestMapping("/api")
public class AdvisorController {

    private final OrchestrationService orchestrationService;

    public AdvisorController(OrchestrationService orchestrationService) {
        this.orchestrationService = orchestrationService;
    }

    @PostMapping("/ask")
    public ResponseEntity<AnswerEnvelope> ask(@RequestBody(required = false) AskRequest request) {
        AnswerEnvelope envelope = request == null
                ? orchestrationService.ask(null, null)
                : orchestrationService.ask(request.question(), request.context());

        if (envelope.error() != null && envelope.error().kind() == ErrorKind.INVALID_REQUEST) {
            return ResponseEntity.badRequest().body(envelope);
        }
        return ResponseEntity.ok(envelope);
    }
}
