package com.smurthy.ai.advisor.routing;

import com.smurthy.ai.advisor.config.RoutingConfig;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import com.smurthy.ai.advisor.model.RoutingDecision;
import com.smurthy.ai.advisor.model.RoutingMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Decides which agent handles a query.
 *
 * <ol>
 *   <li>Score keyword rules. A rule confidence at or above {@code goodThreshold} is final and
 *       the classifier is not called.</li>
 *   <li>Otherwise ask the LLM classifier.</li>
 *   <li>Keep the more confident of the two candidates. When both name the same agent the
 *       decision is {@link RoutingMethod#FUSED}; equal confidences favour the rules.</li>
 *   <li>With no candidate at all the decision is {@link RoutingMethod#NONE}.</li>
 * </ol>
 * Stateless; safe to call concurrently.
 */
@Service
public class IntentRouter {

    private static final Logger log = LoggerFactory.getLogger(IntentRouter.class);

    private final KeywordRuleScorer ruleScorer;
    private final LlmIntentClassifier classifier;
    private final RoutingConfig config;

    public IntentRouter(KeywordRuleScorer ruleScorer, LlmIntentClassifier classifier, RoutingConfig config) {
        this.ruleScorer = ruleScorer;
        this.classifier = classifier;
        this.config = config;
    }

    public RoutingDecision route(String query, List<AgentDescriptor> agents) {
        Optional<RuleScore> rules = ruleScorer.best(query, agents);

        if (rules.isPresent() && rules.get().confidence() >= config.goodThreshold()) {
            RuleScore score = rules.get();
            RoutingDecision decision = RoutingDecision.routed(score.agentId(), score.confidence(), RoutingMethod.RULES,
                    "keywords " + score.matchedKeywords());
            log.info("Routing decision for '{}': {} via rules ({})", query, score.agentId(), decision.confidence());
            return decision;
        }

        ClassificationOutcome llm = classifier.classify(query, agents);
        RoutingDecision decision = fuse(rules, llm);

        log.info("Routing decision for '{}': {} via {} ({}) | {}",
                query, decision.targetAgent().orElse("none"), decision.method(),
                decision.confidence(), decision.rationale());
        return decision;
    }

    RoutingDecision fuse(Optional<RuleScore> rules, ClassificationOutcome llm) {
        boolean hasRules = rules.isPresent();
        boolean hasLlm = llm.hasCandidate();

        if (!hasRules && !hasLlm) {
            return RoutingDecision.none("no keyword match; classifier " + describe(llm));
        }
        if (!hasLlm) {
            RuleScore score = rules.get();
            return RoutingDecision.routed(score.agentId(), score.confidence(), RoutingMethod.RULES,
                    "keywords " + score.matchedKeywords() + "; classifier " + describe(llm));
        }

        String llmAgent = llm.agentId().orElseThrow();
        if (!hasRules) {
            return RoutingDecision.routed(llmAgent, llm.confidence(), RoutingMethod.LLM,
                    "classifier: " + llm.reason());
        }

        RuleScore score = rules.get();
        double rulesConfidence = RoutingDecision.clamp(score.confidence());
        if (score.agentId().equals(llmAgent)) {
            return RoutingDecision.routed(llmAgent, Math.max(rulesConfidence, llm.confidence()), RoutingMethod.FUSED,
                    "keywords " + score.matchedKeywords() + " and classifier agree: " + llm.reason());
        }
        if (rulesConfidence >= llm.confidence()) {
            return RoutingDecision.routed(score.agentId(), rulesConfidence, RoutingMethod.RULES,
                    "keywords " + score.matchedKeywords() + " outweigh classifier choice '" + llmAgent + "'");
        }
        return RoutingDecision.routed(llmAgent, llm.confidence(), RoutingMethod.LLM,
                "classifier: " + llm.reason() + " (outweighs keywords for '" + score.agentId() + "')");
    }

    private static String describe(ClassificationOutcome outcome) {
        return switch (outcome.status()) {
            case CLASSIFIED -> "chose " + outcome.agentId().orElse("?");
            case ABSTAINED -> "abstained";
            case REJECTED -> "output rejected (" + outcome.reason() + ")";
            case FAILED -> "unavailable (" + outcome.reason() + ")";
        };
    }
}
