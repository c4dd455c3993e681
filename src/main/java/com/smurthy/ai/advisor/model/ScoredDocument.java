package com.smurthy.ai.advisor.model;

/**
 * A document paired with its similarity to a query. Score is always within [0, 1].
 */
public record ScoredDocument(Document document, double score) {

    public ScoredDocument {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0,1] but was " + score);
        }
    }
}
