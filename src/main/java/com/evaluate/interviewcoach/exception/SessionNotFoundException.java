package com.evaluate.interviewcoach.exception;

public class SessionNotFoundException extends InterviewCoachException {

    public SessionNotFoundException(String message) {
        super(ErrorCode.SESSION_NOT_FOUND, message);
    }
}
