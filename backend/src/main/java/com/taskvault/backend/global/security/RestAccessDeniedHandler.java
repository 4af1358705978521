package com.taskvault.backend.global.security;

import java.io.IOException;

import com.taskvault.backend.global.error.ErrorKind;
import com.taskvault.backend.global.error.ProblemResponse;
import com.taskvault.backend.global.error.ProblemResponseWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAccessDeniedHandler(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        ProblemResponse body = ProblemResponse.of(
                HttpStatus.FORBIDDEN,
                ErrorKind.FORBIDDEN.defaultCode(),
                null,
                request.getRequestURI()
        );
        problemResponseWriter.write(response, body);
    }
}
