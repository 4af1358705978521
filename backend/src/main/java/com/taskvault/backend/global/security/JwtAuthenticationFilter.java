package com.taskvault.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.taskvault.backend.global.error.ErrorKind;
import com.taskvault.backend.global.error.ProblemException;
import com.taskvault.backend.global.error.ProblemResponseWriter;
import com.taskvault.backend.global.error.RetryableProblemException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the {@link AccessGuard} for requests that carry an {@code Authorization} header.
 *
 * <p>A rejected token leaves the request anonymous; protected routes then answer 401 through
 * {@link RestAuthenticationEntryPoint}. A store outage is answered with 503 right here.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final AccessGuard accessGuard;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(AccessGuard accessGuard, ProblemResponseWriter problemResponseWriter) {
        this.accessGuard = accessGuard;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null) {
            try {
                AuthenticatedAccess access = accessGuard.authenticate(authorization);
                AuthenticatedPrincipal principal = access.principal();
                List<SimpleGrantedAuthority> authorities =
                        List.of(new SimpleGrantedAuthority(principal.role().authority()));

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, access, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (ProblemException ex) {
                SecurityContextHolder.clearContext();
                if (ex.getKind() == ErrorKind.SERVICE_UNAVAILABLE) {
                    writeUnavailable(request, response, ex);
                    return;
                }
            } catch (CannotCreateTransactionException | DataAccessResourceFailureException
                     | TransientDataAccessException ex) {
                SecurityContextHolder.clearContext();
                writeUnavailable(request, response, RetryableProblemException.storeUnavailable("Database", ex));
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    private void writeUnavailable(HttpServletRequest request, HttpServletResponse response, ProblemException ex)
            throws IOException {
        log.warn("Cannot authenticate request, backing store unavailable: {}",
                ex.getCause() != null ? ex.getCause().getClass().getSimpleName() : ex.getCode());
        problemResponseWriter.write(response, ex, request.getRequestURI());
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return request.getMethod().equalsIgnoreCase("OPTIONS");
    }
}
