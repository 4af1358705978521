package com.taskvault.backend.global.error;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes a {@link ProblemResponse} from code running outside the MVC dispatcher
 * (security filters, entry points), where {@link RestExceptionHandler} does not apply.
 */
@Component
public class ProblemResponseWriter {

    private final ObjectMapper objectMapper;

    public ProblemResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, ProblemResponse body) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(body.status());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), body);
    }

    public void write(HttpServletResponse response, ProblemException ex, String instance) throws IOException {
        if (ex instanceof RetryableProblemException retryable) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryable.getRetryAfterSeconds()));
        }
        write(response, ProblemResponse.of(ex, instance));
    }
}
