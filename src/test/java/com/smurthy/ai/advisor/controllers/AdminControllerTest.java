package com.smurthy.ai.advisor.controllers;

import com.smurthy.ai.advisor.agents.AgentRegistry;
import com.smurthy.ai.advisor.model.Document;
import com.smurthy.ai.advisor.retrieval.DocumentCorpus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DocumentCorpus documentCorpus;

    @MockBean
    private AgentRegistry agentRegistry;

    @Test
    @DisplayName("Should report the refreshed corpus size and load time")
    void testRefreshCorpus() throws Exception {
        when(documentCorpus.refresh()).thenReturn(List.of(
                Document.of("F23566", "La TVA", "La TVA est un impôt.", "https://example.fr/F23566")));
        when(documentCorpus.lastLoadedAt()).thenReturn(Optional.of(Instant.parse("2025-01-15T10:00:00Z")));

        mockMvc.perform(post("/api/admin/corpus/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documents").value(1))
                .andExpect(jsonPath("$.loadedAt").value("2025-01-15T10:00:00Z"));
    }

    @Test
    @DisplayName("Should report the number of agents after a registry reload")
    void testReloadRegistry() throws Exception {
        when(agentRegistry.reload()).thenReturn(5);

        mockMvc.perform(post("/api/admin/registry/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agents").value(5));
    }
}
