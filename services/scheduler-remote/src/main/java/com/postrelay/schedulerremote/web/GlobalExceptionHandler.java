package com.postrelay.schedulerremote.web;

import com.postrelay.security.Credential;
import com.postrelay.security.CredentialContext;
import com.postrelay.security.UnauthenticatedException;
import com.postrelay.storage.ResourceOpenException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request-path failures to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://postrelay.dev/errors/unauthenticated",
 *   "title": "Unauthenticated",
 *   "status": 401,
 *   "detail": "No credential in scope for this request; is OAuth configured?",
 *   "timestamp": "2025-07-12T10:30:00Z"
 * }
 * </pre>
 *
 * <p>Responses carry the caller's subject id when one is bound, never a token.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final CredentialContext credentialContext;

    public GlobalExceptionHandler(CredentialContext credentialContext) {
        this.credentialContext = credentialContext;
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ProblemDetail handleUnauthenticated(UnauthenticatedException ex) {
        log.warn("Unauthenticated: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, ex.getMessage());
        problem.setTitle("Unauthenticated");
        problem.setType(URI.create("https://postrelay.dev/errors/unauthenticated"));
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(ResourceOpenException.class)
    public ProblemDetail handleResourceOpen(ResourceOpenException ex) {
        log.error("Storage unavailable at '{}'", ex.path(), ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.SERVICE_UNAVAILABLE, "Storage is temporarily unavailable");
        problem.setTitle("Storage Unavailable");
        problem.setType(URI.create("https://postrelay.dev/errors/storage-unavailable"));
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create("https://postrelay.dev/errors/bad-request"));
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("https://postrelay.dev/errors/internal"));
        enrich(problem);
        return problem;
    }

    private void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        credentialContext.get()
                .flatMap(Credential::subject)
                .ifPresent(subject -> problem.setProperty("subjectId", subject));
    }
}
