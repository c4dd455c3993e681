package com.smurthy.ai.advisor.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.advisor.agents.AgentHttpResponse;
import com.smurthy.ai.advisor.agents.AgentInvoker;
import com.smurthy.ai.advisor.agents.AgentRegistry;
import com.smurthy.ai.advisor.agents.ResponseNormalizer;
import com.smurthy.ai.advisor.config.OrchestratorConfig;
import com.smurthy.ai.advisor.dto.AnswerEnvelope;
import com.smurthy.ai.advisor.dto.AnswerStatus;
import com.smurthy.ai.advisor.dto.ErrorInfo;
import com.smurthy.ai.advisor.exceptions.AdvisorException;
import com.smurthy.ai.advisor.exceptions.ErrorKind;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import com.smurthy.ai.advisor.model.NormalizedResponse;
import com.smurthy.ai.advisor.model.RoutingDecision;
import com.smurthy.ai.advisor.model.RoutingMethod;
import com.smurthy.ai.advisor.routing.IntentRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Orchestrator: Router -> Invoker -> Normalizer, wrapped into an {@link AnswerEnvelope}.
 *
 * Routing never fails the request; it degrades to {@link AnswerStatus#NOT_UNDERSTOOD}. Only the
 * outbound call can produce {@link AnswerStatus#ERROR}, and then with a user-facing message plus
 * a machine-readable {@link ErrorKind}.
 */
@Service
public class OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationService.class);

    static final String NOT_UNDERSTOOD_MESSAGE = "Je ne suis pas sûr de comprendre votre question. "
            + "Pourriez-vous reformuler ou préciser votre demande concernant la fiscalité, "
            + "le droit des affaires ou les aides aux entreprises ?";
    static final String EMPTY_QUESTION_MESSAGE =
            "Aucune question fournie. Format attendu: {\"question\": \"votre question\"}";

    private final IntentRouter intentRouter;
    private final AgentRegistry agentRegistry;
    private final AgentInvoker agentInvoker;
    private final ResponseNormalizer responseNormalizer;
    private final OrchestratorConfig config;
    private final Clock clock;

    public OrchestrationService(IntentRouter intentRouter,
                                AgentRegistry agentRegistry,
                                AgentInvoker agentInvoker,
                                ResponseNormalizer responseNormalizer,
                                OrchestratorConfig config,
                                Clock clock) {
        this.intentRouter = intentRouter;
        this.agentRegistry = agentRegistry;
        this.agentInvoker = agentInvoker;
        this.responseNormalizer = responseNormalizer;
        this.config = config;
        this.clock = clock;
    }

    public AnswerEnvelope ask(String question, Map<String, Object> context) {
        if (question == null || question.isBlank()) {
            return new AnswerEnvelope(question, null, AnswerStatus.ERROR, EMPTY_QUESTION_MESSAGE,
                    List.of(), 0.0, RoutingMethod.NONE, "empty question", Map.of(),
                    new ErrorInfo(ErrorKind.INVALID_REQUEST, "question must not be blank"));
        }

        RequestDeadline deadline = RequestDeadline.startingNow(clock, config.requestTimeout());
        log.info("Question received: {}", question);

        RoutingDecision decision = intentRouter.route(question, agentRegistry.all());
        if (!decision.isRouted()) {
            return new AnswerEnvelope(question, null, AnswerStatus.NOT_UNDERSTOOD, NOT_UNDERSTOOD_MESSAGE,
                    List.of(), decision.confidence(), decision.method(), decision.rationale(), Map.of(), null);
        }

        String agentId = decision.targetAgent().orElseThrow();
        Optional<AgentDescriptor> agent = agentRegistry.find(agentId);
        if (agent.isEmpty() || !agent.get().isCallable()) {
            log.info("Agent '{}' selected but not available", agentId);
            return envelope(question, agentId, decision, AnswerStatus.AGENT_UNAVAILABLE,
                    unavailableMessage(agentId), null);
        }

        AgentHttpResponse response;
        try {
            response = agentInvoker.invoke(agent.get(),
                    AgentInvoker.buildPayload(agent.get(), question, context), deadline);
        } catch (AdvisorException e) {
            log.error("Call to agent '{}' failed ({}): {}", agentId, e.getKind(), e.getMessage());
            return envelope(question, agentId, decision, AnswerStatus.ERROR, failureMessage(e.getKind()),
                    new ErrorInfo(e.getKind(), e.getMessage()));
        }

        if (!response.isSuccess()) {
            log.error("Agent '{}' answered HTTP {}", agentId, response.statusCode());
            return envelope(question, agentId, decision, AnswerStatus.ERROR,
                    failureMessage(ErrorKind.AGENT_FAILURE),
                    new ErrorInfo(ErrorKind.AGENT_FAILURE, "Agent '" + agentId + "' answered HTTP "
                            + response.statusCode()));
        }

        NormalizedResponse normalized = responseNormalizer.normalize(response.body());
        JsonNode handoff = normalized.extraFields().get("handoff");
        if (handoff != null) {
            log.info("Agent '{}' suggests a handoff: {}", agentId, handoff);
        }
        return new AnswerEnvelope(question, agentId, AnswerStatus.ANSWERED, normalized.answerText(),
                normalized.sources(), decision.confidence(), decision.method(), decision.rationale(),
                normalized.extraFields(), null);
    }

    private static AnswerEnvelope envelope(String question, String agentId, RoutingDecision decision,
                                           AnswerStatus status, String answer, ErrorInfo error) {
        return new AnswerEnvelope(question, agentId, status, answer, List.of(), decision.confidence(),
                decision.method(), decision.rationale(), Map.of(), error);
    }

    static String unavailableMessage(String agentId) {
        return "Je comprends que votre question concerne le domaine '" + agentId
                + "', mais cet agent n'est pas encore disponible.";
    }

    static String failureMessage(ErrorKind kind) {
        return switch (kind) {
            case AGENT_AUTH -> "Le service spécialisé a refusé la demande. Merci de contacter l'administrateur.";
            case REQUEST_TIMEOUT -> "Le traitement de votre question a pris trop de temps. Merci de réessayer.";
            case AGENT_UNREACHABLE -> "Le service spécialisé est momentanément injoignable. Merci de réessayer plus tard.";
            default -> "Le service spécialisé n'a pas pu traiter votre question. Merci de réessayer plus tard.";
        };
    }
}
