package com.evaluate.interviewcoach.model;

/**
 * Aspects an answer is scored on besides the overall score. Each one maps to the practice
 * area a low score points at.
 */
public enum AnswerDimension {
    RELEVANCE("Technical knowledge"),
    COMPLETENESS("Response structure"),
    CLARITY("Communication");

    private final String practiceArea;

    AnswerDimension(String practiceArea) {
        this.practiceArea = practiceArea;
    }

    public String getPracticeArea() {
        return practiceArea;
    }
}
