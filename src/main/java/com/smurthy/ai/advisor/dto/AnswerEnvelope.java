package com.smurthy.ai.advisor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.advisor.model.RoutingMethod;
import com.smurthy.ai.advisor.model.SourceRef;

import java.util.List;
import java.util.Map;

/**
 * Final answer returned to the caller of the orchestrator.
 *
 * {@code error} is present only for {@link AnswerStatus#ERROR} and rejected requests;
 * {@code answer} always carries a message fit for the end user.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerEnvelope(
        String question,
        String agentUsed,
        AnswerStatus status,
        String answer,
        List<SourceRef> sources,
        double confidence,
        RoutingMethod method,
        String rationale,
        Map<String, JsonNode> extraFields,
        ErrorInfo error
) {
    public AnswerEnvelope {
        sources = sources == null ? List.of() : sources;
        extraFields = extraFields == null ? Map.of() : extraFields;
    }
}
