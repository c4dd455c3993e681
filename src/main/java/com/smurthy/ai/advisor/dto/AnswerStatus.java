package com.smurthy.ai.advisor.dto;

public enum AnswerStatus {
    ANSWERED,
    NOT_UNDERSTOOD,
    AGENT_UNAVAILABLE,
    ERROR
}
