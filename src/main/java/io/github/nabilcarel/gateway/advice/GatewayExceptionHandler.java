package io.github.nabilcarel.gateway.advice;

import io.github.nabilcarel.gateway.exception.BackendTransportException;
import io.github.nabilcarel.gateway.exception.EndpointLoadException;
import io.github.nabilcarel.gateway.exception.EndpointNotFoundException;
import io.github.nabilcarel.gateway.exception.EnvironmentNotAllowedException;
import io.github.nabilcarel.gateway.exception.InvalidRequestPathException;
import io.github.nabilcarel.gateway.exception.MethodNotAllowedException;
import io.github.nabilcarel.gateway.exception.TargetUrlNotAllowedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GatewayExceptionHandler extends ResponseEntityExceptionHandler {

    private static final String TIMESTAMP = "timestamp";
    private static final String STATUS = "status";
    private static final String ERROR = "error";
    private static final String MESSAGE = "message";

    @ExceptionHandler(EndpointNotFoundException.class)
    public ResponseEntity<Object> handleEndpointNotFound(EndpointNotFoundException ex, WebRequest request) {
        log.debug("Endpoint not found: {}", ex.getEndpointName());
        return build(HttpStatus.NOT_FOUND, "Endpoint Not Found", ex.getMessage(), new HttpHeaders());
    }

    @ExceptionHandler(EnvironmentNotAllowedException.class)
    public ResponseEntity<Object> handleEnvironmentNotAllowed(EnvironmentNotAllowedException ex, WebRequest request) {
        log.warn("Rejected request for environment {}: {}", ex.getEnvironment(), ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "Environment Not Allowed", ex.getMessage(), new HttpHeaders());
    }

    @ExceptionHandler(MethodNotAllowedException.class)
    public ResponseEntity<Object> handleMethodNotAllowed(MethodNotAllowedException ex, WebRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ALLOW, String.join(", ", ex.getAllowedMethods()));
        return build(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", ex.getMessage(), headers);
    }

    @ExceptionHandler(InvalidRequestPathException.class)
    public ResponseEntity<Object> handleInvalidRequestPath(InvalidRequestPathException ex, WebRequest request) {
        log.warn("Rejected request path {}", ex.getPath());
        return build(HttpStatus.BAD_REQUEST, "Invalid Path", ex.getMessage(), new HttpHeaders());
    }

    @ExceptionHandler(TargetUrlNotAllowedException.class)
    public ResponseEntity<Object> handleTargetUrlNotAllowed(TargetUrlNotAllowedException ex, WebRequest request) {
        log.warn("Blocked backend URL {}", ex.getUrl());
        return build(HttpStatus.FORBIDDEN, "Target Not Allowed", "Target URL is not allowed", new HttpHeaders());
    }

    @ExceptionHandler(BackendTransportException.class)
    public ResponseEntity<Object> handleBackendTransport(BackendTransportException ex, WebRequest request) {
        log.error("Backend {} unreachable: {}", ex.getUrl(), ex.getMessage());
        HttpStatus status = ex.isTimedOut() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        return build(status, ex.isTimedOut() ? "Backend Timeout" : "Backend Unavailable", ex.getMessage(),
                new HttpHeaders());
    }

    @ExceptionHandler(EndpointLoadException.class)
    public ResponseEntity<Object> handleEndpointLoad(EndpointLoadException ex, WebRequest request) {
        log.error("Endpoint directory could not be loaded", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Endpoint Load Failed", ex.getMessage(), new HttpHeaders());
    }

    private ResponseEntity<Object> build(HttpStatus status, String error, String message, HttpHeaders headers) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(TIMESTAMP, Instant.now());
        body.put(STATUS, status.value());
        body.put(ERROR, error);
        body.put(MESSAGE, message);
        return new ResponseEntity<>(body, headers, status);
    }
}
