package com.evaluate.interviewcoach.exception;

/** An answer was submitted for a question other than the current one. */
public class OutOfOrderSubmissionException extends InterviewCoachException {

    public OutOfOrderSubmissionException(String message) {
        super(ErrorCode.OUT_OF_ORDER_SUBMISSION, message);
    }
}
