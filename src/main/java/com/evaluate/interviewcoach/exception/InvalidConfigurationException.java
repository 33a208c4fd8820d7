package com.evaluate.interviewcoach.exception;

public class InvalidConfigurationException extends InterviewCoachException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }
}
