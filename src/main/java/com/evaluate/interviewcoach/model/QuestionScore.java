package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QuestionScore {
    String questionId;
    String questionText;
    String targetSkill;
    boolean followUp;
    double score;
}
