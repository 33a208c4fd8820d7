package com.evaluate.interviewcoach.exception;

/** The answer evaluator failed; the answer is withdrawn and may be resubmitted. */
public class EvaluationFailureException extends InterviewCoachException {

    public EvaluationFailureException(String message) {
        super(ErrorCode.EVALUATION_FAILURE, message);
    }

    public EvaluationFailureException(String message, Throwable cause) {
        super(ErrorCode.EVALUATION_FAILURE, message, cause);
    }
}
