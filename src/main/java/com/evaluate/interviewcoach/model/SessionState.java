package com.evaluate.interviewcoach.model;

public enum SessionState {
    CREATED,
    AWAITING_ANSWER,
    EVALUATING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
