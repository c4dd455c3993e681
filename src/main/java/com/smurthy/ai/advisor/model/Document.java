package com.smurthy.ai.advisor.model;

/**
 * A corpus document as produced by ingestion. Immutable; the retrieval core only reads it.
 *
 * @param id        stable id derived from the source URL, unique within a corpus snapshot
 * @param title     document title
 * @param bodyText  plain-text body
 * @param sourceUrl page the document was extracted from
 * @param sizeChars length of the body in characters
 * @param embedding precomputed embedding, or null when the retriever must compute one
 */
public record Document(
        String id,
        String title,
        String bodyText,
        String sourceUrl,
        int sizeChars,
        float[] embedding
) {
    public Document {
        title = title == null ? "" : title;
        bodyText = bodyText == null ? "" : bodyText;
    }

    public static Document of(String id, String title, String bodyText, String sourceUrl) {
        return new Document(id, title, bodyText, sourceUrl, bodyText == null ? 0 : bodyText.length(), null);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
