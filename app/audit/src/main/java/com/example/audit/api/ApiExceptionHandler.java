package com.example.audit.api;

import com.example.audit.archive.ArchiveNotFoundException;
import com.example.audit.archive.InvalidArchiveNameException;
import com.example.audit.service.CleanupConcurrencyLimitException;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final String RETRY_AFTER_SECONDS = "60";

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("AUDIT_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodValidation(
      HandlerMethodValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("AUDIT_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("AUDIT_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(InvalidArchiveNameException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidArchiveName(
      InvalidArchiveNameException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("AUDIT_ARCHIVE_INVALID_NAME", ex.getMessage()));
  }

  @ExceptionHandler(ArchiveNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleArchiveNotFound(ArchiveNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("AUDIT_ARCHIVE_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(CleanupConcurrencyLimitException.class)
  public ResponseEntity<ApiErrorResponse> handleConcurrencyLimit(
      CleanupConcurrencyLimitException ex) {
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(new ApiErrorResponse("AUDIT_CLEANUP_BUSY", ex.getMessage()));
  }

  @ExceptionHandler(CancellationException.class)
  public ResponseEntity<ApiErrorResponse> handleSchedulerStopped(CancellationException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("AUDIT_SCHEDULER_UNAVAILABLE", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled audit admin error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("AUDIT_INTERNAL_ERROR", ex.getMessage()));
  }
}
