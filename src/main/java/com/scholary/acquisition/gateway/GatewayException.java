package com.scholary.acquisition.gateway;

/**
 * Thrown when a gateway call fails.
 *
 * <p>Carries the HTTP status (0 when no response was received, e.g. connection refused or request
 * timeout) and the raw response text. Callers decide whether to retry using {@link #isRetryable()}.
 */
public class GatewayException extends RuntimeException {

  private final int statusCode;

  public GatewayException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public GatewayException(int statusCode, String message, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }

  /** Transport failures, timeouts, throttling and server errors are worth another attempt. */
  public boolean isRetryable() {
    return statusCode == 0 || statusCode == 408 || statusCode == 429 || statusCode >= 500;
  }

  public boolean isNotFound() {
    return statusCode == 404;
  }
}
