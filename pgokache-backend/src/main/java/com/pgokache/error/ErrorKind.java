package com.pgokache.error;

import org.springframework.http.HttpStatus;

/**
 * Machine-classifiable error kinds surfaced to API callers.
 */
public enum ErrorKind {
    CONNECTION_ERROR(HttpStatus.BAD_GATEWAY),
    AUTH_ERROR(HttpStatus.BAD_GATEWAY),
    PERMISSION_ERROR(HttpStatus.FORBIDDEN),
    NOT_READY(HttpStatus.CONFLICT),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INSTANCE_BUSY(HttpStatus.CONFLICT),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
