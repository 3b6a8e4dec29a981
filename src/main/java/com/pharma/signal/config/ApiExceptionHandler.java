package com.pharma.signal.config;

import com.pharma.signal.exception.MonitoringException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Maps pipeline and request failures to RFC 7807 problem responses.
 * Pipeline failures keep their stable error code in the {@code errorCode} property.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
            HttpStatus.BAD_REQUEST, "invalid-parameter",
            HttpStatus.NOT_FOUND, "not-found",
            HttpStatus.UNPROCESSABLE_ENTITY, "unprocessable-series",
            HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
    );

    @ExceptionHandler(MonitoringException.class)
    public ResponseEntity<ProblemDetail> handleMonitoring(MonitoringException ex, HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex, request);
        response.getBody().setProperty("errorCode", ex.getErrorCode());
        return response;
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    }

    private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex, HttpServletRequest request) {
        logException(status, ex, request);
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        detail.setTitle(status.getReasonPhrase());
        detail.setInstance(URI.create(request.getRequestURI()));
        detail.setType(URI.create("urn:signal-monitor:problem:" + TYPE_SLUGS.getOrDefault(status, "internal-error")));
        detail.setProperty("path", request.getRequestURI());
        return ResponseEntity.status(status).body(detail);
    }

    private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getName();
        }
        if (status.is5xxServerError()) {
            log.error("Request {} {} failed with status {}: {}",
                    request.getMethod(), request.getRequestURI(), status.value(), message, ex);
        } else {
            log.warn("Request {} {} returned status {}: {}",
                    request.getMethod(), request.getRequestURI(), status.value(), message);
        }
    }
}
