package com.smurthy.ai.advisor.agents;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smurthy.ai.advisor.model.NormalizedResponse;
import com.smurthy.ai.advisor.model.SourceRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseNormalizerTest {

    private final ResponseNormalizer normalizer = new ResponseNormalizer(new ObjectMapper());

    @Test
    @DisplayName("Should drop an inert handoff and unfence the answer")
    void testHandoffAndFence() {
        // Given
        String raw = "{\"handoff\": {\"needed\": false}, \"reponse\": \"```json\\n{\\\"taux\\\": 20}\\n```\"}";

        // When
        ObjectNode cleaned = normalizer.clean(raw).orElseThrow();
        NormalizedResponse normalized = normalizer.normalize(raw);

        // Then
        assertThat(cleaned.has("handoff")).isFalse();
        assertThat(cleaned.get("reponse").asText()).isEqualTo("{\"taux\": 20}");
        assertThat(normalized.answerText()).isEqualTo("{\"taux\": 20}");
        assertThat(normalized.extraFields()).doesNotContainKey("handoff");
    }

    @Test
    @DisplayName("Should keep an active handoff and drop one pointing at 'none'")
    void testActiveHandoff() {
        NormalizedResponse active = normalizer.normalize(
                "{\"reponse\": \"Voir l'agent juridique\", \"handoff\": {\"needed\": true, \"suggested_agent\": \"juridique\"}}");
        NormalizedResponse none = normalizer.normalize(
                "{\"reponse\": \"ok\", \"handoff\": {\"suggested_agent\": \"none\"}}");

        assertThat(active.extraFields()).containsKey("handoff");
        assertThat(active.extraFields().get("handoff").get("suggested_agent").asText()).isEqualTo("juridique");
        assertThat(none.extraFields()).doesNotContainKey("handoff");
    }

    @Test
    @DisplayName("Should wrap a non-JSON body as the answer text")
    void testPlainText() {
        NormalizedResponse normalized = normalizer.normalize("La TVA est un impôt indirect.");

        assertThat(normalized.answerText()).isEqualTo("La TVA est un impôt indirect.");
        assertThat(normalized.sources()).isEmpty();
        assertThat(normalized.extraFields()).isEmpty();
    }

    @Test
    @DisplayName("Should parse a body wrapped in a code fence")
    void testFencedBody() {
        NormalizedResponse normalized = normalizer.normalize("```json\n{\"answer\": \"Oui\", \"documents_trouves\": 2}\n```");

        assertThat(normalized.answerText()).isEqualTo("Oui");
        assertThat(normalized.extraFields().get("documents_trouves").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should merge alternative source fields into one deduplicated list")
    void testSourceMerge() {
        String raw = """
                {
                  "reponse": "Le taux normal est de 20 %.",
                  "sources": [{"titre": "TVA", "url": "https://example.fr/F23567"}],
                  "sources_officielles": [
                    {"title": "TVA", "url": "https://example.fr/F23567"},
                    {"name": "CGI article 278", "lien": "https://legifrance.example/278"}
                  ],
                  "references": ["https://bofip.example/TVA"],
                  "chunks_trouves": 3
                }
                """;

        NormalizedResponse normalized = normalizer.normalize(raw);

        assertThat(normalized.sources()).containsExactly(
                new SourceRef("TVA", "https://example.fr/F23567"),
                new SourceRef("CGI article 278", "https://legifrance.example/278"),
                new SourceRef("https://bofip.example/TVA", "https://bofip.example/TVA"));
        assertThat(normalized.extraFields()).containsOnlyKeys("chunks_trouves");
    }

    @Test
    @DisplayName("Should be idempotent")
    void testIdempotent() {
        List<String> payloads = List.of(
                "{\"handoff\": {\"needed\": false}, \"reponse\": \"```json\\n{\\\"a\\\": 1}\\n```\"}",
                "{\"reponse\": \"```\\n```markdown\\ntexte\\n```\\n```\", \"sources\": [\"https://x.fr\"]}",
                "{\"answer\": {\"detail\": \"objet\"}, \"response\": \"texte\", \"handoff\": {\"needed\": true}}",
                "{\"explanation\": \"\", \"citations\": [{\"uri\": \"https://y.fr\"}], \"note\": \"```sql\\nselect 1\\n```\"}",
                "Réponse en texte brut",
                "```\nRéponse clôturée\n```",
                "[1, 2, 3]");

        for (String raw : payloads) {
            NormalizedResponse once = normalizer.normalize(raw);
            NormalizedResponse twice = normalizer.normalize(normalizer.toPayload(once).toString());

            assertThat(twice).as("normalize twice: %s", raw).isEqualTo(once);
        }
    }

    @Test
    @DisplayName("Should strip nested fences completely")
    void testStripFence() {
        assertThat(ResponseNormalizer.stripFence("```json\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
        assertThat(ResponseNormalizer.stripFence("```\n```md\ntexte\n```\n```")).isEqualTo("texte");
        assertThat(ResponseNormalizer.stripFence("pas de bloc")).isEqualTo("pas de bloc");
        assertThat(ResponseNormalizer.stripFence("```")).isEqualTo("```");
    }
}
