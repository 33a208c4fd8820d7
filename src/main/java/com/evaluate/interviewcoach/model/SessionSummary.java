package com.evaluate.interviewcoach.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SessionSummary {
    String sessionId;
    InterviewType interviewType;
    int totalQuestions;
    int followUpCount;
    double meanScore;
    /** Ascending by lowest per-question score. */
    List<WeakArea> weakAreas;
    List<QuestionScore> questionScores;
}
