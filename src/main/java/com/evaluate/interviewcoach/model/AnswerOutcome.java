package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AnswerOutcome {
    String sessionId;
    String questionId;
    /** False when the session was aborted before the evaluation could be stored. */
    boolean accepted;
    Evaluation evaluation;
    Question followUp;
    Question nextQuestion;
    SessionState state;
}
