package com.smurthy.ai.advisor.exceptions;

/**
 * Base type for every failure that propagates out of the retrieval or orchestration core.
 */
public abstract class AdvisorException extends RuntimeException {

    private final ErrorKind kind;

    protected AdvisorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AdvisorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
