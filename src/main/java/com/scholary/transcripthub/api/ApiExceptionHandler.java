package com.scholary.transcripthub.api;

import com.scholary.transcripthub.exception.ConflictException;
import com.scholary.transcripthub.exception.NotFoundException;
import com.scholary.transcripthub.exception.PermissionDeniedException;
import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.exception.TranscriptHubException;
import com.scholary.transcripthub.exception.ValidationException;
import java.io.IOException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Maps domain exceptions to HTTP statuses and an {@link ApiError} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiError> handleValidation(ValidationException e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage(), null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return error(HttpStatus.BAD_REQUEST, message, null);
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class,
    MissingRequestHeaderException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleBadInput(Exception e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage(), null);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException e) {
    return error(HttpStatus.PAYLOAD_TOO_LARGE, e.getMessage(), null);
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
    return error(HttpStatus.NOT_FOUND, e.getMessage(), null);
  }

  @ExceptionHandler(ConflictException.class)
  public ResponseEntity<ApiError> handleConflict(ConflictException e) {
    return error(HttpStatus.CONFLICT, e.getMessage(), e.getExistingId());
  }

  @ExceptionHandler(PermissionDeniedException.class)
  public ResponseEntity<ApiError> handlePermissionDenied(PermissionDeniedException e) {
    return error(HttpStatus.FORBIDDEN, e.getMessage(), null);
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ApiError> handleProvider(ProviderException e) {
    LOGGER.warn("Upstream failure from {}: {}", e.getProvider(), e.getMessage());
    return error(HttpStatus.BAD_GATEWAY, e.getMessage(), null);
  }

  @ExceptionHandler(TranscriptHubException.class)
  public ResponseEntity<ApiError> handleInternal(TranscriptHubException e) {
    LOGGER.error("Request failed", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), null);
  }

  @ExceptionHandler(IOException.class)
  public ResponseEntity<ApiError> handleIo(IOException e) {
    LOGGER.error("I/O failure while handling request", e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "I/O failure: " + e.getMessage(), null);
  }

  private static ResponseEntity<ApiError> error(
      HttpStatus status, String message, String existingId) {
    return ResponseEntity.status(status)
        .body(
            new ApiError(
                status.value(), status.getReasonPhrase(), message, existingId, Instant.now()));
  }
}
