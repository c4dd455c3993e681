package com.smurthy.ai.advisor.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.advisor.config.RoutingConfig;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import com.smurthy.ai.advisor.model.RequestFormat;
import com.smurthy.ai.advisor.model.RoutingDecision;
import com.smurthy.ai.advisor.model.RoutingMethod;
import com.smurthy.ai.advisor.service.TextGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for IntentRouter: rules short-circuit, classifier fallback and fusion.
 *
 * The classifier is real; only the text generator behind it is mocked, so the call count on the
 * generator is the call count on the LLM.
 */
@ExtendWith(MockitoExtension.class)
class IntentRouterTest {

    private static final List<AgentDescriptor> AGENTS = List.of(
            agent("fiscalite", "tva", "impot", "cfe"),
            agent("juridique", "contrat", "statuts"),
            agent("aides", "subvention", "cfe"));

    @Mock
    private TextGenerator textGenerator;

    private IntentRouter router;

    @BeforeEach
    void setUp() {
        RoutingConfig config = new RoutingConfig(0.8, 0.8, 0.1, 0.5, 0.0, 256);
        router = new IntentRouter(new KeywordRuleScorer(config),
                new LlmIntentClassifier(textGenerator, new ObjectMapper(), config), config);
    }

    @Test
    @DisplayName("Should route a TVA question by rules without calling the classifier")
    void testRulesShortCircuit() {
        RoutingDecision decision = router.route("C'est quoi la TVA ?", AGENTS);

        assertThat(decision.targetAgent()).contains("fiscalite");
        assertThat(decision.method()).isEqualTo(RoutingMethod.RULES);
        assertThat(decision.confidence()).isGreaterThanOrEqualTo(0.8);
        verifyNoInteractions(textGenerator);
    }

    @Test
    @DisplayName("Should route nowhere when no keyword matches and the classifier names an unknown agent")
    void testUnknownLabelFallsBackToNone() {
        // Given
        when(textGenerator.generate(anyString(), anyDouble(), anyInt()))
                .thenReturn("{\"agent\": \"astrologie\", \"confidence\": 0.95, \"reason\": \"horoscope\"}");

        // When
        RoutingDecision decision = router.route("Quel est mon horoscope ?", AGENTS);

        // Then
        assertThat(decision.method()).isEqualTo(RoutingMethod.NONE);
        assertThat(decision.targetAgent()).isEmpty();
        assertThat(decision.confidence()).isZero();
        verify(textGenerator, times(1)).generate(anyString(), anyDouble(), anyInt());
    }

    @Test
    @DisplayName("Should use the classifier when no keyword matches")
    void testClassifierOnly() {
        when(textGenerator.generate(anyString(), anyDouble(), anyInt()))
                .thenReturn("{\"agent\": \"juridique\", \"confidence\": 0.75, \"reason\": \"forme sociale\"}");

        RoutingDecision decision = router.route("Dois-je créer une SAS ou une SARL ?", AGENTS);

        assertThat(decision.targetAgent()).contains("juridique");
        assertThat(decision.method()).isEqualTo(RoutingMethod.LLM);
        assertThat(decision.confidence()).isEqualTo(0.75);
    }

    @Test
    @DisplayName("Should fuse weak rules and classifier when they agree")
    void testFusedWhenAgreeing() {
        // "cfe" matches two agents, so the rule confidence drops under the threshold
        when(textGenerator.generate(anyString(), anyDouble(), anyInt()))
                .thenReturn("{\"agent\": \"fiscalite\", \"confidence\": 0.7, \"reason\": \"CFE\"}");

        RoutingDecision decision = router.route("Quand payer la CFE ?", AGENTS);

        assertThat(decision.targetAgent()).contains("fiscalite");
        assertThat(decision.method()).isEqualTo(RoutingMethod.FUSED);
        assertThat(decision.confidence()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Should fall back to weak rules when the classifier fails")
    void testRulesWhenClassifierFails() {
        when(textGenerator.generate(anyString(), anyDouble(), anyInt())).thenThrow(new IllegalStateException("timeout"));

        RoutingDecision decision = router.route("Quand payer la CFE ?", AGENTS);

        assertThat(decision.targetAgent()).contains("fiscalite");
        assertThat(decision.method()).isEqualTo(RoutingMethod.RULES);
        assertThat(decision.confidence()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Should keep the more confident candidate and favour rules on ties")
    void testFusionRules() {
        Optional<RuleScore> rules = Optional.of(new RuleScore("juridique", List.of("contrat"), 0.6));

        RoutingDecision llmWins = router.fuse(rules, ClassificationOutcome.classified("aides", 0.9, "subvention"));
        assertThat(llmWins.targetAgent()).contains("aides");
        assertThat(llmWins.method()).isEqualTo(RoutingMethod.LLM);

        RoutingDecision rulesWin = router.fuse(rules, ClassificationOutcome.classified("aides", 0.5, "subvention"));
        assertThat(rulesWin.targetAgent()).contains("juridique");
        assertThat(rulesWin.method()).isEqualTo(RoutingMethod.RULES);

        RoutingDecision tie = router.fuse(rules, ClassificationOutcome.classified("aides", 0.6, "subvention"));
        assertThat(tie.targetAgent()).contains("juridique");
        assertThat(tie.method()).isEqualTo(RoutingMethod.RULES);

        RoutingDecision nothing = router.fuse(Optional.empty(), ClassificationOutcome.abstained("hors sujet"));
        assertThat(nothing.method()).isEqualTo(RoutingMethod.NONE);
        assertThat(nothing.targetAgent()).isEmpty();
    }

    private static AgentDescriptor agent(String id, String... keywords) {
        return new AgentDescriptor(id, "http://localhost/" + id, false, false, true,
                RequestFormat.QUESTION, "Agent " + id, List.of(keywords));
    }
}
