package com.smurthy.ai.advisor.retrieval;

import com.smurthy.ai.advisor.config.RetrievalConfig;
import com.smurthy.ai.advisor.model.Document;
import com.smurthy.ai.advisor.model.ScoredDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextAssemblerTest {

    private ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ContextAssembler(new RetrievalConfig(3, 0.3, 3, 1000, 3000, 800, 400, 0.7));
    }

    @Test
    @DisplayName("Should return the sentinel for an empty ranking whatever the budget")
    void testEmptyRanking() {
        assertThat(assembler.assemble(List.of(), 0)).isEqualTo(ContextAssembler.NO_DOCUMENTS);
        assertThat(assembler.assemble(List.of(), 3000)).isEqualTo(ContextAssembler.NO_DOCUMENTS);
        assertThat(assembler.assemble(null, 50)).isEqualTo(ContextAssembler.NO_DOCUMENTS);
    }

    @Test
    @DisplayName("Should render one block per document with title, source and content")
    void testBlockFormat() {
        // Given
        Document doc = Document.of("F23566", "La TVA", "La TVA est un impôt indirect.",
                "https://entreprendre.service-public.fr/vosdroits/F23566");

        // When
        String context = assembler.assemble(List.of(new ScoredDocument(doc, 0.9)), 3000);

        // Then
        assertThat(context).isEqualTo("""
                --- Document 1 ---
                Titre: La TVA
                Source: https://entreprendre.service-public.fr/vosdroits/F23566
                Contenu:
                La TVA est un impôt indirect.
                """);
    }

    @Test
    @DisplayName("Should use placeholders for missing title and URL")
    void testPlaceholders() {
        Document doc = Document.of("x", null, "Corps.", null);

        String context = assembler.assemble(List.of(new ScoredDocument(doc, 0.5)), 3000);

        assertThat(context).contains("Titre: Sans titre").contains("Source: URL non disponible");
    }

    @Test
    @DisplayName("Should stay within the total budget and stop adding documents")
    void testTotalBudget() {
        // Given
        List<ScoredDocument> ranked = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            ranked.add(new ScoredDocument(Document.of("d" + i, "Document " + i, "mot ".repeat(500), null), 0.9 - i * 0.1));
        }

        // When
        String context = assembler.assemble(ranked, 3000);

        // Then
        assertThat(context.length()).isLessThanOrEqualTo(3000);
        assertThat(context).contains("--- Document 1 ---").doesNotContain("--- Document 6 ---");
    }

    @Test
    @DisplayName("Should truncate the first block when even it does not fit")
    void testTinyBudget() {
        Document doc = Document.of("d", "Titre", "Texte sans ponctuation ".repeat(50), null);

        String context = assembler.assemble(List.of(new ScoredDocument(doc, 0.9)), 60);

        assertThat(context.length()).isLessThanOrEqualTo(60);
        assertThat(context).startsWith("--- Document 1 ---");
    }

    @Test
    @DisplayName("Should strip links and bare URLs and collapse whitespace")
    void testCleanBody() {
        String body = "Voir <a href=\"https://x.fr\">la fiche</a> et [le guide](https://y.fr)\n\n"
                + "ou https://z.fr/page   directement.";

        assertThat(assembler.cleanBody(body)).isEqualTo("Voir la fiche et le guide ou directement.");
    }

    @Test
    @DisplayName("Should cut at a sentence end past 70% of the limit, otherwise append an ellipsis")
    void testTruncate() {
        String sentences = "Premiere phrase assez longue. Suite";
        assertThat(assembler.truncate(sentences, 32)).isEqualTo("Premiere phrase assez longue.");

        String early = "Court. Puis un long passage sans aucun point";
        assertThat(assembler.truncate(early, 20)).isEqualTo("Court. Puis un long...");

        assertThat(assembler.truncate("court", 20)).isEqualTo("court");
    }
}
