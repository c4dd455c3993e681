package com.smurthy.ai.advisor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire format of the corpus-grounded responder ({@code POST /agents/fiscal}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponderAnswer(
        @JsonProperty("question") String question,
        @JsonProperty("reponse") String answer,
        @JsonProperty("chunks_trouves") int documentsFound,
        @JsonProperty("sources") List<Source> sources
) {
    public record Source(@JsonProperty("titre") String title, @JsonProperty("url") String url) {
    }
}
