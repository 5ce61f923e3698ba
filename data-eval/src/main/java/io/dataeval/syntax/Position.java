package io.dataeval.syntax;

/**
 * Location of a character or token in the source text.
 *
 * @param offset zero-based character offset into the normalised source
 * @param line one-based line number
 * @param column one-based column number
 */
public record Position(int offset, int line, int column) {

  public static final Position START = new Position(0, 1, 1);

  @Override
  public String toString() {
    return "line " + line + ", column " + column;
  }
}
