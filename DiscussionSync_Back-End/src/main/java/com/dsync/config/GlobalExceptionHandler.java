package com.dsync.config;

import com.dsync.controller.WebhookPayloadException;
import com.dsync.repo.CollaboratorException;
import com.dsync.service.SyncStatisticsService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the HTTP endpoints
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Autowired
    private SyncStatisticsService statistics;

    @ExceptionHandler(WebhookPayloadException.class)
    public ResponseEntity<Map<String, Object>> handleWebhookPayloadException(WebhookPayloadException exc,
                                                                            HttpServletRequest request) {
        log.warn("Invalid webhook payload on {}: {}", request.getRequestURI(), exc.getMessage());
        return error(HttpStatus.BAD_REQUEST, exc.getMessage());
    }

    /**
     * A sync triggered by the request failed on GitHub or Discord. The next trigger resumes it.
     */
    @ExceptionHandler(CollaboratorException.class)
    public ResponseEntity<Map<String, Object>> handleCollaboratorException(CollaboratorException exc,
                                                                          HttpServletRequest request) {
        log.error("Sync failed on {} ({}): {}", request.getRequestURI(), exc.getKind(), exc.getMessage(), exc);
        statistics.recordFailure("webhook", request.getRequestURI(), exc);
        HttpStatus status = exc.getKind() == CollaboratorException.Kind.TRANSIENT
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.BAD_GATEWAY;
        Map<String, Object> body = errorBody(status, exc.getMessage());
        body.put("kind", exc.getKind().name());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception exc, HttpServletRequest request) {
        // Spring MVC errors such as an unsupported media type keep their own status
        if (exc instanceof ErrorResponse errorResponse) {
            HttpStatusCode code = errorResponse.getStatusCode();
            log.warn("Request on {} rejected with {}: {}", request.getRequestURI(), code.value(), exc.getMessage());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "error");
            body.put("code", code.value());
            body.put("message", exc.getMessage());
            return ResponseEntity.status(code).body(body);
        }
        log.error("Unexpected error on {}: {}", request.getRequestURI(), exc.getMessage(), exc);
        statistics.recordFailure("http", request.getRequestURI(), exc);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, exc.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(errorBody(status, message));
    }

    private static Map<String, Object> errorBody(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("code", status.value());
        body.put("message", message);
        return body;
    }
}
