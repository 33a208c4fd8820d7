package com.evaluate.interviewcoach.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Answer {
    String questionId;
    @Builder.Default
    String rawText = "";
    /** Absent until the answer evaluator has run. */
    Evaluation evaluation;

    @JsonIgnore
    public boolean isEvaluated() {
        return evaluation != null;
    }
}
