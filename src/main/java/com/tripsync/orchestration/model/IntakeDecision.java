package com.tripsync.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * What the intake agent understood from a message, and whether planning can start.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntakeDecision(
        @JsonProperty("has_sufficient_info") boolean sufficientInfo,
        @JsonProperty("missing_info") List<String> missingInfo,
        @JsonProperty("clarifying_questions") List<String> clarifyingQuestions,
        @JsonProperty("extracted_info") Map<String, Object> extractedInfo,
        @JsonProperty("intent") String intent,
        @JsonProperty("reasoning") String reasoning,
        @JsonProperty("clarification_reply") String clarificationReply
) {

    public IntakeDecision {
        missingInfo = missingInfo == null ? List.of() : List.copyOf(missingInfo);
        clarifyingQuestions = clarifyingQuestions == null ? List.of() : List.copyOf(clarifyingQuestions);
        extractedInfo = extractedInfo == null ? Map.of() : extractedInfo;
    }
}
