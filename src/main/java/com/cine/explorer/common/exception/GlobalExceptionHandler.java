package com.cine.explorer.common.exception;

import com.cine.explorer.common.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Result<Void>> handleEntityNotFound(EntityNotFoundException ex) {
        log.warn("Entity not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Result<Void>> handleValidation(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(BuildInProgressException.class)
    public ResponseEntity<Result<Void>> handleBuildInProgress(BuildInProgressException ex) {
        log.warn("Build rejected: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(BuildCancelledException.class)
    public ResponseEntity<Result<Void>> handleBuildCancelled(BuildCancelledException ex) {
        log.warn("Build cancelled: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(BuildFailedException.class)
    public ResponseEntity<Result<Void>> handleBuildFailed(BuildFailedException ex) {
        log.error("Build failed in phase {}", ex.getPhase(), ex);
        HttpStatus status = switch (ex.getErrorCode()) {
            case "ERR-SRC-001", "ERR-WRT-001" -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return respond(status, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(BaseCineException.class)
    public ResponseEntity<Result<Void>> handleBaseCineException(BaseCineException ex) {
        log.warn("Application exception: [{}] {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Result<Void>> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing request parameter: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "ERR-REQ-003", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Result<Void>> handleArgumentTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Type mismatch for parameter {}: {}", ex.getName(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "ERR-REQ-004", "Invalid value for parameter: " + ex.getName());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Result<Void>> handleDataAccessException(DataAccessException ex) {
        log.error("Database error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "ERR-DB-002", "Database operation failed");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleGenericException(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "ERR-SYS-001", "An unexpected error occurred: " + ex.getMessage());
    }

    private static ResponseEntity<Result<Void>> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Result.fail(code, message));
    }
}
