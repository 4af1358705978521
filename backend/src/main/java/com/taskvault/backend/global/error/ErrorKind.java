package com.taskvault.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Closed error taxonomy shared by the auth core and the task module.
 * The kind fixes the HTTP status; the code inside a {@link ProblemException} may be more specific.
 */
public enum ErrorKind {
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "INVALID_INPUT"),
    DUPLICATE_RESOURCE(HttpStatus.CONFLICT, "DUPLICATE_RESOURCE"),
    AUTHENTICATION_FAILED(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "FORBIDDEN"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE");

    private final HttpStatus status;
    private final String defaultCode;

    ErrorKind(HttpStatus status, String defaultCode) {
        this.status = status;
        this.defaultCode = defaultCode;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultCode() {
        return defaultCode;
    }
}
