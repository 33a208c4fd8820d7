package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WeakArea {
    /**
     * Canonical skill name, the interview type label for untargeted questions, or the practice
     * area of a low-scoring answer dimension.
     */
    String area;
    Skill skill;
    /** Set only for areas derived from dimension scores. */
    AnswerDimension dimension;
    double lowestScore;
    double meanScore;
    int questionCount;
}
