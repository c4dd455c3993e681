package com.smurthy.ai.advisor.dto;

import java.util.Map;

/**
 * Body of {@code POST /api/ask}. {@code context} is optional caller data (e.g. a company profile)
 * forwarded to agents that ask for it.
 */
public record AskRequest(String question, Map<String, Object> context) {
}
