package com.github.forax.dynproxy;

/**
 * Thrown when a generated proxy asks for a method that was never registered.
 * This is a bug of the proxy generator, not something a caller can recover from.
 */
public class MethodDescriptorNotFoundException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public MethodDescriptorNotFoundException(String message) {
    super(message);
  }
}
