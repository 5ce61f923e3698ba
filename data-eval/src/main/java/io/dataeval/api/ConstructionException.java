package io.dataeval.api;

import io.dataeval.syntax.Position;

/**
 * Thrown when a whitelisted constructor rejects its arguments, e.g. an invalid calendar date or
 * an unknown keyword argument.
 */
public class ConstructionException extends UnsafeSourceException {
  private final String reason;

  public ConstructionException(String reason, String descriptor) {
    this(reason, descriptor, null, null);
  }

  public ConstructionException(
      String reason, String descriptor, Position position, Throwable cause) {
    super(reason, descriptor, position, cause, "CONSTRUCTION");
    this.reason = reason;
  }

  /** The constructor's own explanation, without context or error code. */
  public String getReason() {
    return reason;
  }

  /**
   * Returns this exception attributed to the call site at {@code position}. Exceptions that
   * already carry a position are returned as is.
   *
   * @param position the position of the call expression
   * @return a ConstructionException with a position
   */
  public ConstructionException at(Position position) {
    if (getPosition() != null || position == null) {
      return this;
    }
    return new ConstructionException(reason, getDescriptor(), position, getCause());
  }
}
