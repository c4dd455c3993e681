package com.smurthy.ai.advisor.exceptions;

import java.time.Duration;

public class RequestTimeoutException extends AdvisorException {

    public RequestTimeoutException(Duration budget) {
        super(ErrorKind.REQUEST_TIMEOUT, "Request deadline of " + budget.toMillis() + "ms exceeded");
    }
}
