package io.dataeval.syntax;

/**
 * A single token of the literal language.
 *
 * <p>For {@link TokenType#STRING} the text is the decoded string value. For every other type it is
 * the exact source text of the token.
 *
 * @param type the type of this token
 * @param text the token text
 * @param isFloat whether a {@link TokenType#NUMBER} token is a floating point literal
 * @param position where the token starts
 */
public record Token(TokenType type, String text, boolean isFloat, Position position) {

  public Token(TokenType type, String text, Position position) {
    this(type, text, false, position);
  }

  public boolean is(TokenType expected) {
    return type == expected;
  }

  /** Returns a short description for error messages. */
  public String describe() {
    return switch (type) {
      case EOF -> "end of input";
      case STRING -> "string literal";
      case NUMBER -> "number '" + text + "'";
      case IDENTIFIER -> "identifier '" + text + "'";
      default -> "'" + text + "'";
    };
  }

  @Override
  public String toString() {
    return String.format("%s['%s']@%d:%d", type, text, position.line(), position.column());
  }
}
