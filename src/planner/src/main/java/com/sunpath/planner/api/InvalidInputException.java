package com.sunpath.planner.api;

/**
 * Domain-level exception raised for malformed or out-of-range inputs.
 *
 * <p>Thrown by request parsing and by the computational core instead of letting NaN propagate.
 * Mapped to HTTP 400 by {@link ApiExceptionHandler}.
 */
public class InvalidInputException extends RuntimeException {
  /**
   * Creates an invalid-input exception with a client-facing message.
   *
   * @param message validation error description
   */
  public InvalidInputException(String message) {
    super(message);
  }
}
