package io.dataeval.syntax;

/** Token types of the literal language. */
public enum TokenType {
  // Structure tokens
  /** Opening brace: { */
  LBRACE,

  /** Closing brace: } */
  RBRACE,

  /** Opening square bracket: [ */
  LBRACKET,

  /** Closing square bracket: ] */
  RBRACKET,

  /** Opening parenthesis: ( */
  LPAREN,

  /** Closing parenthesis: ) */
  RPAREN,

  /** Comma: , */
  COMMA,

  /** Colon separating dict keys and values: : */
  COLON,

  /** Minus, either literal negation or (rejected) subtraction: - */
  MINUS,

  /** Dot in qualified callee names: . */
  DOT,

  /** Keyword argument binding: = */
  EQUALS,

  /** Any other operator symbol: + * / // % ** @ &lt; &gt; == != &amp; | ^ ~ &lt;&lt; &gt;&gt; */
  OPERATOR,

  // Content tokens
  /** Numeric literal: 12, 0x1f, 1.5, .5e-3 */
  NUMBER,

  /** String literal, already unescaped */
  STRING,

  /** Bare identifier */
  IDENTIFIER,

  /** End of input */
  EOF
}
