package com.smurthy.ai.advisor.agents;

import com.smurthy.ai.advisor.config.RegistryConfig;
import com.smurthy.ai.advisor.model.AgentDescriptor;
import com.smurthy.ai.advisor.model.RequestFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentRegistryTest {

    @Mock
    private AgentRegistrySource source;

    private RegistryConfig config;

    @BeforeEach
    void setUp() {
        Map<String, RegistryConfig.AgentProperties> agents = new LinkedHashMap<>();
        agents.put("fiscalite", new RegistryConfig.AgentProperties("http://localhost:8080/agents/fiscal",
                false, false, true, RequestFormat.QUESTION, "Fiscalité", List.of("tva", "cfe")));
        agents.put("juridique", new RegistryConfig.AgentProperties(null,
                true, false, true, RequestFormat.USER_QUERY, "Juridique", List.of("contrat")));
        agents.put("comptabilite", new RegistryConfig.AgentProperties(null,
                false, false, false, RequestFormat.QUESTION, "Comptabilité", List.of("bilan")));
        config = new RegistryConfig(agents, new RegistryConfig.DynamoDb(false, null, "eu-west-3", "agent_registry"));
    }

    @Test
    @DisplayName("Should expose static defaults in configuration order")
    void testDefaultsOnly() {
        AgentRegistry registry = new AgentRegistry(config, (AgentRegistrySource) null);

        assertThat(registry.all()).extracting(AgentDescriptor::id)
                .containsExactly("fiscalite", "juridique", "comptabilite");
        assertThat(registry.find("fiscalite")).hasValueSatisfying(a -> assertThat(a.isCallable()).isTrue());
        assertThat(registry.find("juridique")).hasValueSatisfying(a -> assertThat(a.isCallable()).isFalse());
        assertThat(registry.find("inconnu")).isEmpty();
    }

    @Test
    @DisplayName("Should overlay registry entries field by field")
    void testOverrides() {
        // Given
        when(source.loadOverrides()).thenReturn(List.of(
                new AgentOverride("juridique", "https://juridique.example/run", null, null, null, null, null, null),
                new AgentOverride("fiscalite", null, null, null, false, null, null, null)));
        when(source.describe()).thenReturn("test source");
        AgentRegistry registry = new AgentRegistry(config, source);

        // When
        AgentDescriptor juridique = registry.find("juridique").orElseThrow();
        AgentDescriptor fiscalite = registry.find("fiscalite").orElseThrow();

        // Then
        assertThat(juridique.endpointUrl()).isEqualTo("https://juridique.example/run");
        assertThat(juridique.requiresAuth()).isTrue();
        assertThat(juridique.requestFormat()).isEqualTo(RequestFormat.USER_QUERY);
        assertThat(juridique.keywords()).containsExactly("contrat");
        assertThat(fiscalite.enabled()).isFalse();
        assertThat(fiscalite.endpointUrl()).isEqualTo("http://localhost:8080/agents/fiscal");
    }

    @Test
    @DisplayName("Should add unknown agents only when they carry an endpoint")
    void testUnknownAgents() {
        when(source.loadOverrides()).thenReturn(List.of(
                new AgentOverride("social", "https://social.example/run", null, null, null, null, "Social", List.of("urssaf")),
                new AgentOverride("fantome", null, null, null, true, null, null, null)));
        when(source.describe()).thenReturn("test source");

        AgentRegistry registry = new AgentRegistry(config, source);

        assertThat(registry.find("social")).hasValueSatisfying(a -> {
            assertThat(a.isCallable()).isTrue();
            assertThat(a.requestFormat()).isEqualTo(RequestFormat.QUESTION);
            assertThat(a.keywords()).containsExactly("urssaf");
        });
        assertThat(registry.find("fantome")).isEmpty();
    }

    @Test
    @DisplayName("Should keep the defaults when the source cannot be read")
    void testSourceFailure() {
        when(source.loadOverrides()).thenThrow(new IllegalStateException("table missing"));
        when(source.describe()).thenReturn("test source");

        AgentRegistry registry = new AgentRegistry(config, source);

        assertThat(registry.all()).hasSize(3);
    }

    @Test
    @DisplayName("Should load lazily once and re-read the source on reload")
    void testReload() {
        when(source.loadOverrides()).thenReturn(List.of());
        when(source.describe()).thenReturn("test source");
        AgentRegistry registry = new AgentRegistry(config, source);

        registry.all();
        registry.find("fiscalite");
        int count = registry.reload();

        assertThat(count).isEqualTo(3);
        verify(source, times(2)).loadOverrides();
    }
}
