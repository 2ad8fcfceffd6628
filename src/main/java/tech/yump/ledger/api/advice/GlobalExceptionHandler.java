package tech.yump.ledger.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.ledger.audit.AuditHelper;
import tech.yump.ledger.event.Outcome;
import tech.yump.ledger.retention.BuiltInPolicyException;
import tech.yump.ledger.retention.PolicyNotFoundException;
import tech.yump.ledger.storage.StorageException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Pattern POLICY_PATH_PATTERN = Pattern.compile(".*/v1/retention/policies/([^/]+)(?:/run)?");

    private final AuditHelper auditHelper;

    @ExceptionHandler(PolicyNotFoundException.class)
    public ResponseEntity<ProblemDetail> handlePolicyNotFound(PolicyNotFoundException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.NOT_FOUND;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Policy Not Found");
        log.warn("Policy not found: {}. Request: {} {}", ex.getPolicyId(), request.getMethod(), request.getRequestURI());

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(BuiltInPolicyException.class)
    public ResponseEntity<ProblemDetail> handleBuiltInPolicy(BuiltInPolicyException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.CONFLICT;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Built-in Policy");

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorageException(StorageException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "The ledger storage could not be written or read.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Storage Error");
        log.error("Storage error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditFailure(request, status, message);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditFailure(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        List<String> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .sorted()
                .toList();
        String message = violations.isEmpty() ? "Request validation failed." : String.join("; ", violations);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Validation failed: {}. Request: {}", message, request.getDescription(false));

        if (request instanceof ServletWebRequest servletWebRequest) {
            auditHelper.logHttpEvent("request_validation", determineAction(servletWebRequest.getRequest()), Outcome.FAILURE,
                    status.value(), message, extractContextData(servletWebRequest.getRequest()));
        }
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please check the JSON format and enumerated values.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: unreadable body. Request: {}. Details: {}", request.getDescription(false), ex.getMessage());

        if (request instanceof ServletWebRequest servletWebRequest) {
            auditHelper.logHttpEvent("request_validation", determineAction(servletWebRequest.getRequest()), Outcome.FAILURE,
                    status.value(), message, extractContextData(servletWebRequest.getRequest()));
        } else {
            log.error("Could not obtain HttpServletRequest from WebRequest for audit logging in handleHttpMessageNotReadable.");
        }
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditHelper.logHttpEvent("system_error", determineAction(request), Outcome.FAILURE, status.value(), message,
                extractContextData(request));
        return ResponseEntity.status(status).body(problemDetail);
    }

    private void auditFailure(HttpServletRequest request, HttpStatus status, String message) {
        auditHelper.logHttpEvent(determineEventType(request), determineAction(request), Outcome.FAILURE,
                status.value(), message, extractContextData(request));
    }

    private String determineEventType(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.startsWith("/v1/ledger/")) {
            return "ledger";
        }
        if (path.startsWith("/v1/retention/policies") && !"GET".equalsIgnoreCase(request.getMethod())
                && !path.endsWith("/run")) {
            return "policy";
        }
        if (path.startsWith("/v1/retention/")) {
            return "retention";
        }
        return "request_error";
    }

    private String determineAction(HttpServletRequest request) {
        String path = request.getRequestURI();
        String method = request.getMethod().toUpperCase();

        if (path.endsWith("/v1/ledger/events")) return "POST".equals(method) ? "append" : "query";
        if (path.endsWith("/v1/ledger/verify")) return "verify";
        if (path.endsWith("/v1/ledger/stats")) return "stats";
        if (path.endsWith("/v1/retention/run")) return "run_due";
        if (path.endsWith("/v1/retention/status")) return "status";
        if (path.endsWith("/run")) return "force_run";
        if (path.endsWith("/v1/retention/policies")) return "POST".equals(method) ? "create_policy" : "list_policies";
        if (path.contains("/v1/retention/policies/")) {
            return switch (method) {
                case "GET" -> "get_policy";
                case "PATCH" -> "update_policy";
                case "DELETE" -> "delete_policy";
                default -> "unknown_policy";
            };
        }
        return "unknown";
    }

    private Map<String, Object> extractContextData(HttpServletRequest request) {
        Map<String, Object> data = new HashMap<>();
        Matcher policyMatcher = POLICY_PATH_PATTERN.matcher(request.getRequestURI());
        if (policyMatcher.matches()) {
            data.put("policy_id", policyMatcher.group(1));
        }
        return data;
    }
}
