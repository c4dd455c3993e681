package com.smurthy.ai.advisor.retrieval;

import com.smurthy.ai.advisor.config.RetrievalConfig;
import com.smurthy.ai.advisor.exceptions.EmbeddingProviderException;
import com.smurthy.ai.advisor.model.Document;
import com.smurthy.ai.advisor.model.ScoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks corpus documents against a query by embedding cosine similarity.
 *
 * Each document is embedded as its title repeated {@code titleRepeat} times followed by the
 * first {@code bodyPrefixChars} of its body, which pulls the vector toward the document's topic.
 * A stored {@link Document#embedding()} is not used for scoring, since it was not computed from
 * that representation.
 * Documents that cannot be embedded are dropped from the ranking; the rest still rank.
 */
@Service
public class SemanticRetriever {

    private static final Logger log = LoggerFactory.getLogger(SemanticRetriever.class);

    private final EmbeddingCache embeddingCache;
    private final RetrievalConfig config;

    public SemanticRetriever(EmbeddingCache embeddingCache, RetrievalConfig config) {
        this.embeddingCache = embeddingCache;
        this.config = config;
    }

    public List<ScoredDocument> retrieve(String query, List<Document> corpus) {
        return retrieve(query, corpus, config.topK(), config.minScore());
    }

    /**
     * @return at most {@code k} documents scoring at least {@code minScore}, best first;
     *         equal scores keep corpus order
     */
    public List<ScoredDocument> retrieve(String query, List<Document> corpus, int k, double minScore) {
        if (corpus == null || corpus.isEmpty() || k <= 0) {
            return List.of();
        }

        float[] queryVector;
        try {
            queryVector = embeddingCache.getOrCompute(query);
        } catch (EmbeddingProviderException e) {
            log.warn("Query embedding failed, no documents retrieved: {}", e.getMessage());
            return List.of();
        }

        long start = System.currentTimeMillis();
        List<ScoredDocument> kept = new ArrayList<>();
        int failed = 0;

        for (Document doc : corpus) {
            double score;
            try {
                score = CosineSimilarity.score(queryVector, embeddingCache.getOrCompute(weightedRepresentation(doc)));
            } catch (EmbeddingProviderException | IllegalArgumentException e) {
                failed++;
                log.warn("Document '{}' excluded from scoring: {}", doc.id(), e.getMessage());
                continue;
            }
            log.debug("Document '{}' ({}) scored {}", doc.id(), doc.title(), String.format("%.3f", score));
            if (score >= minScore) {
                kept.add(new ScoredDocument(doc, score));
            }
        }

        // List.sort is stable, so ties keep corpus order
        kept.sort(Comparator.comparingDouble(ScoredDocument::score).reversed());
        List<ScoredDocument> ranked = kept.size() > k ? List.copyOf(kept.subList(0, k)) : List.copyOf(kept);

        log.info("Retrieved {} of {} document(s) (minScore={}, k={}, excluded={}) in {}ms",
                ranked.size(), corpus.size(), minScore, k, failed, System.currentTimeMillis() - start);
        return ranked;
    }

    /**
     * The text embedded for a document: weighted title plus body prefix.
     */
    String weightedRepresentation(Document doc) {
        String title = doc.title().strip();
        String body = doc.bodyText();
        String bodyPrefix = body.length() > config.bodyPrefixChars()
                ? body.substring(0, config.bodyPrefixChars())
                : body;
        if (title.isEmpty()) {
            return bodyPrefix;
        }
        return String.join(" ", Collections.nCopies(config.titleRepeat(), title)) + "\n" + bodyPrefix;
    }
}
