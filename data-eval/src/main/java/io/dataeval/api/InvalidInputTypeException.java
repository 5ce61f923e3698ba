package io.dataeval.api;

/** Thrown when the source is neither text nor an already-structured mapping. */
public class InvalidInputTypeException extends DataEvalException {

  public InvalidInputTypeException(String message) {
    super(message, null, "INVALID_INPUT");
  }

  public InvalidInputTypeException(String message, String context) {
    super(message, context, "INVALID_INPUT");
  }

  /**
   * Creates an exception describing the rejected source type.
   *
   * @param source the rejected source, may be {@code null}
   * @return a new InvalidInputTypeException instance
   */
  public static InvalidInputTypeException forSource(Object source) {
    String type = source == null ? "null" : source.getClass().getName();
    return new InvalidInputTypeException("Source must be a string or a mapping", type);
  }
}
