package com.bank.dispute.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    COMPLIANCE_VIOLATION(HttpStatus.UNPROCESSABLE_ENTITY),
    DISPUTE_CLOSED(HttpStatus.CONFLICT),
    DEADLINE_COMPUTATION_FAILURE(HttpStatus.UNPROCESSABLE_ENTITY),
    DUPLICATE_REQUEST(HttpStatus.CONFLICT),
    DOWNSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    EVIDENCE_LIMIT_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    DISPUTE_NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
