package com.serviceclient.api;

import com.serviceclient.exception.CircuitOpenException;
import com.serviceclient.exception.GatewayErrorResponseException;
import com.serviceclient.exception.InvalidConfigurationException;
import com.serviceclient.exception.MaxRetriesExceededException;
import com.serviceclient.exception.RequestTimeoutException;
import com.serviceclient.exception.ServiceClientException;
import com.serviceclient.exception.ServiceDiscoveryException;
import com.serviceclient.exception.ServiceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.CompletionException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ApiErrorResponse> handleCircuitOpen(CircuitOpenException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "CIRCUIT_OPEN", ex.getMessage());
    }

    @ExceptionHandler(GatewayErrorResponseException.class)
    public ResponseEntity<ApiErrorResponse> handleGatewayError(GatewayErrorResponseException ex) {
        return respond(statusOf(ex.getErrorCode(), HttpStatus.BAD_REQUEST), ex.getErrorType(), ex.getMessage());
    }

    @ExceptionHandler(RequestTimeoutException.class)
    public ResponseEntity<ApiErrorResponse> handleTimeout(RequestTimeoutException ex) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, "TIMEOUT", ex.getMessage());
    }

    @ExceptionHandler({ServiceUnavailableException.class, MaxRetriesExceededException.class})
    public ResponseEntity<ApiErrorResponse> handleUpstreamFailure(ServiceClientException ex) {
        return respond(HttpStatus.BAD_GATEWAY, "UPSTREAM_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(ServiceDiscoveryException.class)
    public ResponseEntity<ApiErrorResponse> handleDiscovery(ServiceDiscoveryException ex) {
        return respond(HttpStatus.BAD_REQUEST, "ROUTE_NOT_RESOLVED", ex.getMessage());
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<ApiErrorResponse> handleConfiguration(InvalidConfigurationException ex) {
        log.error("Service client misconfigured: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INVALID_CONFIGURATION", ex.getMessage());
    }

    @ExceptionHandler(ServiceClientException.class)
    public ResponseEntity<ApiErrorResponse> handleClientError(ServiceClientException ex) {
        HttpStatus status = statusOf(ex.getErrorCode(), HttpStatus.BAD_GATEWAY);
        return respond(status, "SERVICE_CLIENT_ERROR", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request");
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ApiErrorResponse> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof CircuitOpenException) {
            return handleCircuitOpen((CircuitOpenException) cause);
        }
        if (cause instanceof GatewayErrorResponseException) {
            return handleGatewayError((GatewayErrorResponseException) cause);
        }
        if (cause instanceof RequestTimeoutException) {
            return handleTimeout((RequestTimeoutException) cause);
        }
        if (cause instanceof ServiceUnavailableException || cause instanceof MaxRetriesExceededException) {
            return handleUpstreamFailure((ServiceClientException) cause);
        }
        if (cause instanceof ServiceDiscoveryException) {
            return handleDiscovery((ServiceDiscoveryException) cause);
        }
        if (cause instanceof ServiceClientException) {
            return handleClientError((ServiceClientException) cause);
        }
        log.error("Unhandled asynchronous failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    private static HttpStatus statusOf(Integer code, HttpStatus fallback) {
        if (code == null) {
            return fallback;
        }
        HttpStatus resolved = HttpStatus.resolve(code);
        return resolved == null ? fallback : resolved;
    }

    private static ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiErrorResponse(status.name(), code, message));
    }
}
