package com.taskvault.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final ErrorKind kind;
    private final String code;
    private final String detail;

    public ProblemException(ErrorKind kind) {
        this(kind, kind.defaultCode(), null, null);
    }

    public ProblemException(ErrorKind kind, String code) {
        this(kind, code, null, null);
    }

    public ProblemException(ErrorKind kind, String code, String detail) {
        this(kind, code, detail, null);
    }

    public ProblemException(ErrorKind kind, String code, String detail, Throwable cause) {
        super(kind.status(), code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public static ProblemException invalidInput(String code, String detail) {
        return new ProblemException(ErrorKind.INVALID_INPUT, code, detail);
    }

    public static ProblemException notFound(String code) {
        return new ProblemException(ErrorKind.NOT_FOUND, code);
    }

    public static ProblemException unauthenticated() {
        return new ProblemException(ErrorKind.UNAUTHENTICATED);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
