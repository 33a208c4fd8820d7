package com.evaluate.interviewcoach.exception;

public class ExtractionFailureException extends InterviewCoachException {

    public ExtractionFailureException(String message) {
        super(ErrorCode.EXTRACTION_FAILURE, message);
    }

    public ExtractionFailureException(String message, Throwable cause) {
        super(ErrorCode.EXTRACTION_FAILURE, message, cause);
    }
}
