package com.smurthy.ai.advisor.exceptions;

public class CorpusUnavailableException extends AdvisorException {

    public CorpusUnavailableException(String message, Throwable cause) {
        super(ErrorKind.CORPUS_UNAVAILABLE, message, cause);
    }
}
