package com.evaluate.interviewcoach.exception;

/** Not enough requirement or gap data to generate meaningful questions. */
public class InsufficientContextException extends InterviewCoachException {

    public InsufficientContextException(String message) {
        super(ErrorCode.INSUFFICIENT_CONTEXT, message);
    }
}
