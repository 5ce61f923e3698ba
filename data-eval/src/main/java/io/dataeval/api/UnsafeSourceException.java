package io.dataeval.api;

import io.dataeval.syntax.Position;

/**
 * Thrown when the source is syntactically valid but uses a construct outside the literal
 * language: a bare identifier, a callable missing from the whitelist, an operator, or a
 * negation of something that is not a number.
 */
public class UnsafeSourceException extends DataEvalException {
  private final String descriptor;
  private final Position position;

  public UnsafeSourceException(String message, String descriptor, Position position) {
    this(message, descriptor, position, null, "UNSAFE");
  }

  protected UnsafeSourceException(
      String message, String descriptor, Position position, Throwable cause, String errorCode) {
    super(message, cause, describe(descriptor, position), errorCode);
    this.descriptor = descriptor;
    this.position = position;
  }

  private static String describe(String descriptor, Position position) {
    if (descriptor == null) {
      return position == null ? null : position.toString();
    }
    return position == null ? "'" + descriptor + "'" : "'" + descriptor + "' at " + position;
  }

  /** The offending identifier, callee or operator, if known. */
  public String getDescriptor() {
    return descriptor;
  }

  public Position getPosition() {
    return position;
  }
}
