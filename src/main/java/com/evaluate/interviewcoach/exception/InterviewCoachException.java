package com.evaluate.interviewcoach.exception;

import lombok.Getter;

@Getter
public abstract class InterviewCoachException extends RuntimeException {

    private final ErrorCode code;

    protected InterviewCoachException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected InterviewCoachException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
