package com.smurthy.ai.advisor.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical view of a responder payload after control metadata has been stripped.
 *
 * @param answerText  the answer shown to the user
 * @param sources     canonical source list, merged from every alternative field name
 * @param extraFields every other top-level field, in payload order
 */
public record NormalizedResponse(
        String answerText,
        List<SourceRef> sources,
        Map<String, JsonNode> extraFields
) {
    public NormalizedResponse {
        answerText = answerText == null ? "" : answerText;
        sources = sources == null ? List.of() : List.copyOf(sources);
        extraFields = extraFields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }
}
