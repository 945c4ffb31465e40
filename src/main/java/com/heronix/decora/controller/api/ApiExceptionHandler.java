package com.heronix.decora.controller.api;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.heronix.decora.exception.ApiRequestException;
import com.heronix.decora.exception.AuthException;
import com.heronix.decora.exception.ConfigSaveException;
import com.heronix.decora.exception.DecryptionException;
import com.heronix.decora.exception.KeyCorruptException;
import com.heronix.decora.exception.KeyFileAccessException;
import com.heronix.decora.exception.NotAuthenticatedException;
import com.heronix.decora.exception.TokenExpiredException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps bridge failures onto HTTP responses for the REST API.
 *
 * Session problems are 401, upstream Decora failures 502 (404 when the device
 * is unknown upstream), bad input 400, unusable stored credentials 500.
 */
@RestControllerAdvice(basePackageClasses = ApiExceptionHandler.class)
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({NotAuthenticatedException.class, TokenExpiredException.class, AuthException.class})
    public ResponseEntity<Map<String, Object>> handleSessionFailure(RuntimeException e) {
        log.warn("API: Session failure: {}", e.getMessage());
        return failure(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(ApiRequestException.class)
    public ResponseEntity<Map<String, Object>> handleUpstreamFailure(ApiRequestException e) {
        // a device unknown upstream is unknown here too
        HttpStatus status = e.getStatusCode() == HttpStatus.NOT_FOUND.value()
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_GATEWAY;

        log.error("API: Decora request failed (status {}): {}", e.getStatusCode(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of(
                "success", false,
                "message", e.getMessage(),
                "upstreamStatus", e.getStatusCode()
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadArgument(IllegalArgumentException e) {
        return failure(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return failure(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler({DecryptionException.class, KeyCorruptException.class, KeyFileAccessException.class})
    public ResponseEntity<Map<String, Object>> handleCredentialFailure(RuntimeException e) {
        log.error("API: Stored credentials are unusable: {}", e.getMessage());
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Stored credentials could not be decrypted");
    }

    @ExceptionHandler(ConfigSaveException.class)
    public ResponseEntity<Map<String, Object>> handleSaveFailure(ConfigSaveException e) {
        log.error("API: Failed to persist configuration: {}", e.getMessage());
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to save configuration");
    }

    private static ResponseEntity<Map<String, Object>> failure(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "success", false,
                "message", message != null ? message : status.getReasonPhrase()
        ));
    }
}
