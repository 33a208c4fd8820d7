package com.evaluate.interviewcoach.exception;

/** The call is not allowed in the session's current state; the session is left unchanged. */
public class InvalidStateException extends InterviewCoachException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
