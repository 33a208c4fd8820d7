package com.evaluate.interviewcoach.exception;

public class UnsupportedFormatException extends InterviewCoachException {

    public UnsupportedFormatException(String message) {
        super(ErrorCode.UNSUPPORTED_FORMAT, message);
    }
}
