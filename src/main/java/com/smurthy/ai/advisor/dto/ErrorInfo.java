package com.smurthy.ai.advisor.dto;

import com.smurthy.ai.advisor.exceptions.ErrorKind;

public record ErrorInfo(ErrorKind kind, String message) {
}
