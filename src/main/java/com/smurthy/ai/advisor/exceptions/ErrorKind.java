package com.smurthy.ai.advisor.exceptions;

/**
 * Machine-readable failure categories surfaced in logs and answer envelopes.
 */
public enum ErrorKind {
    EMBEDDING_PROVIDER,
    CORPUS_UNAVAILABLE,
    CLASSIFICATION_PARSE,
    TRANSPORT,
    AGENT_UNREACHABLE,
    AGENT_AUTH,
    AGENT_FAILURE,
    MALFORMED_RESPONSE,
    REQUEST_TIMEOUT,
    INVALID_REQUEST
}
