package com.meridian.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps routing failures to RFC 7807 problem details.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_BASE = "https://meridian.dev/errors/";

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAdmissionDenied(AdmissionDeniedException ex) {
        ProblemDetail problem = problem(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(),
                "admission-denied", "Admission Denied");
        problem.setProperty("reason", ex.getReason().getCode());
        problem.setProperty("organizationId", ex.getOrganizationId());

        ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        if (ex.getRetryAfterMs() != null) {
            problem.setProperty("retryAfterMs", ex.getRetryAfterMs());
            long seconds = Math.max(1, (ex.getRetryAfterMs() + 999) / 1000);
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
        }
        return response.body(problem);
    }

    @ExceptionHandler(PolicyNotFoundException.class)
    public ProblemDetail handlePolicyNotFound(PolicyNotFoundException ex) {
        log.warn("Policy not found: org={}", ex.getOrganizationId());
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "policy-not-found", "Policy Not Found");
    }

    @ExceptionHandler(DecisionNotFoundException.class)
    public ProblemDetail handleDecisionNotFound(DecisionNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "decision-not-found", "Decision Not Found");
    }

    @ExceptionHandler(InvalidPolicyException.class)
    public ProblemDetail handleInvalidPolicy(InvalidPolicyException ex) {
        log.warn("Invalid policy: {}", ex.getViolations());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "invalid-policy", "Invalid Policy");
        problem.setProperty("violations", ex.getViolations());
        return problem;
    }

    @ExceptionHandler(NoEligibleModelException.class)
    public ProblemDetail handleNoEligibleModel(NoEligibleModelException ex) {
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(),
                "no-eligible-model", "No Eligible Model");
        problem.setProperty("alternatives", ex.getAlternatives());
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Invalid Request");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.", "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_BASE + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
