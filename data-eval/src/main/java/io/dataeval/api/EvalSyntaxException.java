package io.dataeval.api;

import io.dataeval.syntax.Position;

/**
 * Thrown when the source text does not match the literal grammar. Carries the position of the
 * offending character or token.
 */
public class EvalSyntaxException extends DataEvalException {
  private final Position position;

  public EvalSyntaxException(String message, Position position) {
    super(message, position == null ? null : position.toString(), "SYNTAX");
    this.position = position;
  }

  public Position getPosition() {
    return position;
  }
}
