package com.evaluate.interviewcoach.exception;

public class NotCompletedException extends InterviewCoachException {

    public NotCompletedException(String message) {
        super(ErrorCode.NOT_COMPLETED, message);
    }
}
