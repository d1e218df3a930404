package com.example.fileaudit.web;

import com.example.fileaudit.ErrorKind;
import com.example.fileaudit.FileAuditException;
import com.example.fileaudit.store.AuditStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class FileAuditExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileAuditExceptionHandler.class);

    @ExceptionHandler(FileAuditException.class)
    public ResponseEntity<ErrorView> handle(FileAuditException ex) {
        HttpStatus status = statusFor(ex.kind());
        if (status.is5xxServerError()) {
            LOGGER.error("Request failed ({}): {}", ex.kind(), ex.getMessage(), ex);
        } else {
            LOGGER.info("Request rejected ({}): {}", ex.kind(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorView(ex.kind().name(), ex.getMessage()));
    }

    @ExceptionHandler(AuditStoreException.class)
    public ResponseEntity<ErrorView> handle(AuditStoreException ex) {
        LOGGER.error("Audit store failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorView("AUDIT_STORE", "The audit database is unavailable. Try again later."));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_ARCHIVED, INVALID_STATE, UNSUPPORTED_SOURCE -> HttpStatus.BAD_REQUEST;
            case COLLABORATOR_UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case PATH_ESCAPE, NOT_READABLE, COLLABORATOR_FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_FOUND, COLLABORATOR_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case COLLABORATOR_RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case COLLABORATOR_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case FINGERPRINT_MISMATCH, COLLABORATOR_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
