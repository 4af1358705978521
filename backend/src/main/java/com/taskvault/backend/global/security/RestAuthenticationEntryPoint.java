package com.taskvault.backend.global.security;

import java.io.IOException;

import com.taskvault.backend.global.error.ErrorKind;
import com.taskvault.backend.global.error.ProblemResponse;
import com.taskvault.backend.global.error.ProblemResponseWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        // same body whatever went wrong with the credential
        ProblemResponse body = ProblemResponse.of(
                HttpStatus.UNAUTHORIZED,
                ErrorKind.UNAUTHENTICATED.defaultCode(),
                "Could not validate credentials",
                request.getRequestURI()
        );
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        problemResponseWriter.write(response, body);
    }
}
