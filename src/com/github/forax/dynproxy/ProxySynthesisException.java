package com.github.forax.dynproxy;

/**
 * Thrown when a proxy class can not be generated or loaded for a set of interfaces.
 */
public class ProxySynthesisException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ProxySynthesisException(String message) {
    super(message);
  }

  public ProxySynthesisException(String message, Throwable cause) {
    super(message, cause);
  }
}
