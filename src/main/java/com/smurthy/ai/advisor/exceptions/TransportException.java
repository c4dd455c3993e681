package com.smurthy.ai.advisor.exceptions;

/**
 * Connection-level failure (timeout, refused connection, reset) on a single outbound attempt.
 * The only failure the invoker retries.
 */
public class TransportException extends AdvisorException {

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
