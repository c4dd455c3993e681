package com.smurthy.ai.advisor.store;

import com.smurthy.ai.advisor.exceptions.CorpusUnavailableException;

import java.util.List;

/**
 * Blob store holding the ingested corpus, one JSON object per document.
 */
public interface DocumentStore {

    /**
     * List and fetch every object under {@code prefix}.
     *
     * @throws CorpusUnavailableException when the store cannot be listed or read
     */
    List<StoredObject> listDocuments(String prefix);
}
