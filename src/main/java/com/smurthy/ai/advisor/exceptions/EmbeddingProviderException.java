package com.smurthy.ai.advisor.exceptions;

/**
 * The embedding provider failed or returned an empty vector.
 * Callers treat this as "no score contribution" for the affected text.
 */
public class EmbeddingProviderException extends AdvisorException {

    public EmbeddingProviderException(String message, Throwable cause) {
        super(ErrorKind.EMBEDDING_PROVIDER, message, cause);
    }

    public EmbeddingProviderException(String message) {
        super(ErrorKind.EMBEDDING_PROVIDER, message);
    }
}
