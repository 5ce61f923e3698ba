package io.dataeval.syntax;

import io.dataeval.api.EvalSyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Single-pass tokenizer for the literal language.
 *
 * <p>The lexer handles:
 *
 * <ul>
 *   <li>Structure tokens: { } [ ] ( ) , : - . =
 *   <li>Operators: + * / // % ** @ &lt; &gt; &lt;= &gt;= == != &amp; | ^ ~ &lt;&lt; &gt;&gt;
 *   <li>Numbers: decimal, hexadecimal (0x), octal (0o) and binary (0b) integers, decimals with
 *       optional exponent, {@code _} digit separators
 *   <li>Strings: single, double and triple quoted, optional {@code u}/{@code r} prefix
 *   <li>Identifiers: {@code [A-Za-z_][A-Za-z0-9_]*}
 *   <li>Insignificant: whitespace, line breaks, {@code #} comments, backslash continuations
 * </ul>
 *
 * <p>String tokens carry their decoded value, so the parser never sees escape sequences.
 */
public final class Lexer {
  private final String input;
  private int pos = 0;
  private int line = 1;
  private int lineStart = 0;

  private Lexer(String input) {
    this.input = input;
  }

  /**
   * Tokenizes the source text.
   *
   * @param source the source text; {@code null} is treated as empty
   * @return tokens in source order, always ending with an {@link TokenType#EOF} token
   * @throws EvalSyntaxException on an unterminated string, a malformed number or an unrecognized
   *     character
   */
  public static List<Token> tokenize(String source) {
    return new Lexer(source == null ? "" : source).run();
  }

  private List<Token> run() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipInsignificant();
      if (eof()) {
        break;
      }
      Position start = position();
      char c = input.charAt(pos);

      if (c == '"' || c == '\'') {
        tokens.add(readString(start, false));
        continue;
      }

      if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
        tokens.add(readNumber(start));
        continue;
      }

      if (isIdentifierStart(c)) {
        String ident = readIdentifier();
        String prefix = ident.toLowerCase(Locale.ROOT);
        if ((prefix.equals("u") || prefix.equals("r")) && !eof() && isQuote(input.charAt(pos))) {
          tokens.add(readString(start, prefix.equals("r")));
        } else {
          tokens.add(new Token(TokenType.IDENTIFIER, ident, start));
        }
        continue;
      }

      Token symbol = readSymbol(start);
      if (symbol == null) {
        throw new EvalSyntaxException("Unrecognized character '" + printable(c) + "'", start);
      }
      tokens.add(symbol);
    }
    tokens.add(new Token(TokenType.EOF, "", position()));
    return tokens;
  }

  private void skipInsignificant() {
    while (!eof()) {
      char c = input.charAt(pos);
      if (c == ' ' || c == '\t' || c == '\f' || c == '\n' || c == '\r' || c == '\u000b') {
        advance();
      } else if (c == '#') {
        while (!eof() && input.charAt(pos) != '\n' && input.charAt(pos) != '\r') {
          advance();
        }
      } else if (c == '\\' && pos + 1 < input.length() && isLineBreak(input.charAt(pos + 1))) {
        advance();
        advance();
      } else {
        return;
      }
    }
  }

  // Strings

  private Token readString(Position start, boolean raw) {
    char quote = advance();
    boolean triple = false;
    if (pos + 1 < input.length()
        && input.charAt(pos) == quote
        && input.charAt(pos + 1) == quote) {
      pos += 2;
      triple = true;
    }
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (eof()) {
        throw unterminated(start, triple);
      }
      char c = input.charAt(pos);
      if (c == quote) {
        if (!triple) {
          advance();
          break;
        }
        if (pos + 2 < input.length()
            && input.charAt(pos + 1) == quote
            && input.charAt(pos + 2) == quote) {
          pos += 3;
          break;
        }
        sb.append(advance());
        continue;
      }
      if (isLineBreak(c) && !triple) {
        throw unterminated(start, false);
      }
      if (c == '\\') {
        if (raw) {
          sb.append(advance());
          if (eof()) {
            throw unterminated(start, triple);
          }
          sb.append(advance());
        } else {
          readEscape(sb, start, triple);
        }
        continue;
      }
      sb.append(advance());
    }
    return new Token(TokenType.STRING, sb.toString(), start);
  }

  private void readEscape(StringBuilder sb, Position stringStart, boolean triple) {
    Position escape = position();
    advance(); // backslash
    if (eof()) {
      throw unterminated(stringStart, triple);
    }
    char e = advance();
    switch (e) {
      case '\n', '\r' -> {
        // line continuation inside the literal
        if (e == '\r' && !eof() && input.charAt(pos) == '\n') advance();
      }
      case '\\' -> sb.append('\\');
      case '\'' -> sb.append('\'');
      case '"' -> sb.append('"');
      case 'a' -> sb.append('\u0007');
      case 'b' -> sb.append('\b');
      case 'f' -> sb.append('\f');
      case 'n' -> sb.append('\n');
      case 'r' -> sb.append('\r');
      case 't' -> sb.append('\t');
      case 'v' -> sb.append('\u000b');
      case 'x' -> sb.appendCodePoint(readHex(2, escape));
      case 'u' -> sb.appendCodePoint(readHex(4, escape));
      case 'U' -> sb.appendCodePoint(readHex(8, escape));
      case 'N' -> throw new EvalSyntaxException("Named Unicode escapes are not supported", escape);
      default -> {
        if (e >= '0' && e <= '7') {
          int value = e - '0';
          for (int i = 0; i < 2 && !eof() && isOctal(input.charAt(pos)); i++) {
            value = value * 8 + (advance() - '0');
          }
          sb.appendCodePoint(value);
        } else {
          // unknown escapes are kept verbatim
          sb.append('\\').append(e);
        }
      }
    }
  }

  private int readHex(int digits, Position escape) {
    long value = 0;
    for (int i = 0; i < digits; i++) {
      int d = eof() ? -1 : digit(input.charAt(pos), 16);
      if (d < 0) {
        throw new EvalSyntaxException(
            "Truncated escape sequence, expected " + digits + " hex digits", escape);
      }
      advance();
      value = value * 16 + d;
    }
    if (value > Character.MAX_CODE_POINT) {
      throw new EvalSyntaxException("Illegal Unicode character in escape sequence", escape);
    }
    return (int) value;
  }

  private EvalSyntaxException unterminated(Position start, boolean triple) {
    return new EvalSyntaxException(
        triple ? "Unterminated triple-quoted string literal" : "Unterminated string literal",
        start);
  }

  // Numbers

  private Token readNumber(Position start) {
    int begin = pos;
    if (input.charAt(pos) == '0' && pos + 1 < input.length()) {
      int radix = radixOf(input.charAt(pos + 1));
      if (radix != 0) {
        pos += 2;
        int digitsStart = pos;
        while (!eof() && (digit(input.charAt(pos), radix) >= 0 || input.charAt(pos) == '_')) {
          pos++;
        }
        String text = input.substring(begin, pos);
        if (pos == digitsStart || !validUnderscores(text, radix, 2)) {
          throw new EvalSyntaxException("Invalid numeric literal '" + text + "'", start);
        }
        rejectTrailing(begin, start);
        return new Token(TokenType.NUMBER, text, false, start);
      }
    }

    boolean isFloat = false;
    skipDecimalDigits();
    if (!eof() && input.charAt(pos) == '.') {
      isFloat = true;
      pos++;
      skipDecimalDigits();
    }
    if (!eof() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
      int save = pos;
      pos++;
      if (!eof() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
        pos++;
      }
      if (!eof() && isDigit(input.charAt(pos))) {
        isFloat = true;
        skipDecimalDigits();
      } else {
        pos = save;
      }
    }
    String text = input.substring(begin, pos);
    if (!validUnderscores(text, 10, 0)) {
      throw new EvalSyntaxException("Invalid numeric literal '" + text + "'", start);
    }
    if (!isFloat && hasLeadingZero(text)) {
      throw new EvalSyntaxException(
          "Leading zeros in decimal integer literals are not permitted", start);
    }
    rejectTrailing(begin, start);
    return new Token(TokenType.NUMBER, text, isFloat, start);
  }

  private void skipDecimalDigits() {
    while (!eof() && (isDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
      pos++;
    }
  }

  private void rejectTrailing(int begin, Position start) {
    if (!eof() && isIdentifierPart(input.charAt(pos))) {
      int end = pos;
      while (end < input.length() && isIdentifierPart(input.charAt(end))) end++;
      throw new EvalSyntaxException(
          "Invalid numeric literal '" + input.substring(begin, end) + "'", start);
    }
  }

  private static int radixOf(char c) {
    return switch (c) {
      case 'x', 'X' -> 16;
      case 'o', 'O' -> 8;
      case 'b', 'B' -> 2;
      default -> 0;
    };
  }

  /** Underscores are only allowed between digits, or directly after a radix prefix. */
  private static boolean validUnderscores(String text, int radix, int prefixLength) {
    for (int i = prefixLength; i < text.length(); i++) {
      if (text.charAt(i) != '_') continue;
      boolean afterPrefix = prefixLength > 0 && i == prefixLength;
      boolean digitBefore = i > 0 && digit(text.charAt(i - 1), radix) >= 0;
      boolean digitAfter = i + 1 < text.length() && digit(text.charAt(i + 1), radix) >= 0;
      if (!(afterPrefix || digitBefore) || !digitAfter) {
        return false;
      }
    }
    return true;
  }

  private static boolean hasLeadingZero(String text) {
    String digits = text.replace("_", "");
    if (digits.length() < 2 || digits.charAt(0) != '0') return false;
    for (int i = 1; i < digits.length(); i++) {
      if (digits.charAt(i) != '0') return true;
    }
    return false;
  }

  // Identifiers and symbols

  private String readIdentifier() {
    int start = pos;
    while (!eof() && isIdentifierPart(input.charAt(pos))) {
      pos++;
    }
    return input.substring(start, pos);
  }

  private Token readSymbol(Position start) {
    if (pos + 1 < input.length()) {
      String two = input.substring(pos, pos + 2);
      switch (two) {
        case "**", "//", "<<", ">>", "<=", ">=", "==", "!=" -> {
          pos += 2;
          return new Token(TokenType.OPERATOR, two, start);
        }
        default -> {}
      }
    }
    char c = input.charAt(pos);
    TokenType type =
        switch (c) {
          case '{' -> TokenType.LBRACE;
          case '}' -> TokenType.RBRACE;
          case '[' -> TokenType.LBRACKET;
          case ']' -> TokenType.RBRACKET;
          case '(' -> TokenType.LPAREN;
          case ')' -> TokenType.RPAREN;
          case ',' -> TokenType.COMMA;
          case ':' -> TokenType.COLON;
          case '-' -> TokenType.MINUS;
          case '.' -> TokenType.DOT;
          case '=' -> TokenType.EQUALS;
          case '+', '*', '/', '%', '@', '<', '>', '&', '|', '^', '~' -> TokenType.OPERATOR;
          default -> null;
        };
    if (type == null) {
      return null;
    }
    pos++;
    return new Token(type, String.valueOf(c), start);
  }

  // Helpers

  private char advance() {
    char c = input.charAt(pos++);
    if (c == '\n' || (c == '\r' && (eof() || input.charAt(pos) != '\n'))) {
      line++;
      lineStart = pos;
    }
    return c;
  }

  private Position position() {
    return new Position(pos, line, pos - lineStart + 1);
  }

  private boolean eof() {
    return pos >= input.length();
  }

  private static boolean isQuote(char c) {
    return c == '"' || c == '\'';
  }

  private static boolean isLineBreak(char c) {
    return c == '\n' || c == '\r';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  /** ASCII-only variant of {@link Character#digit(char, int)}. */
  private static int digit(char c, int radix) {
    return c < 128 ? Character.digit(c, radix) : -1;
  }

  private static boolean isOctal(char c) {
    return c >= '0' && c <= '7';
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }

  private static String printable(char c) {
    if (c < 0x20 || c == 0x7f) {
      return String.format("\\x%02x", (int) c);
    }
    return String.valueOf(c);
  }
}
