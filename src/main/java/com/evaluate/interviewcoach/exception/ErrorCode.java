package com.evaluate.interviewcoach.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    INVALID_CONFIGURATION(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_FORMAT(HttpStatus.BAD_REQUEST),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_STATE(HttpStatus.CONFLICT),
    OUT_OF_ORDER_SUBMISSION(HttpStatus.CONFLICT),
    NOT_COMPLETED(HttpStatus.CONFLICT),
    INSUFFICIENT_CONTEXT(HttpStatus.UNPROCESSABLE_ENTITY),
    EXTRACTION_FAILURE(HttpStatus.UNPROCESSABLE_ENTITY),
    EVALUATION_FAILURE(HttpStatus.BAD_GATEWAY);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
