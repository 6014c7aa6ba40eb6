package com.scholary.acquisition.api;

import com.scholary.acquisition.gateway.GatewayException;
import java.io.UncheckedIOException;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions escaping the controllers to JSON error bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(GatewayException.class)
  public ResponseEntity<ApiError> handleGateway(GatewayException e) {
    LOGGER.warn("Gateway call failed: status={}, {}", e.getStatusCode(), e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiError(HttpStatus.BAD_GATEWAY.value(), e.getMessage(), e.getStatusCode()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ResponseEntity.badRequest()
        .body(new ApiError(HttpStatus.BAD_REQUEST.value(), message, null));
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
    return ResponseEntity.badRequest()
        .body(new ApiError(HttpStatus.BAD_REQUEST.value(), e.getMessage(), null));
  }

  @ExceptionHandler(RejectedExecutionException.class)
  public ResponseEntity<ApiError> handleRejected(RejectedExecutionException e) {
    LOGGER.warn("Background pool is full: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiError(
                HttpStatus.SERVICE_UNAVAILABLE.value(), "Server busy, try again later", null));
  }

  @ExceptionHandler(UncheckedIOException.class)
  public ResponseEntity<ApiError> handleIo(UncheckedIOException e) {
    LOGGER.error("I/O failure while handling request", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiError(HttpStatus.INTERNAL_SERVER_ERROR.value(), e.getMessage(), null));
  }
}
