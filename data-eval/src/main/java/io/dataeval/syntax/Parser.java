package io.dataeval.syntax;

import io.dataeval.api.EvalSyntaxException;
import io.dataeval.syntax.SyntaxTree.BinaryOpNode;
import io.dataeval.syntax.SyntaxTree.BoolLiteral;
import io.dataeval.syntax.SyntaxTree.CallNode;
import io.dataeval.syntax.SyntaxTree.DictEntry;
import io.dataeval.syntax.SyntaxTree.DictNode;
import io.dataeval.syntax.SyntaxTree.KeywordArg;
import io.dataeval.syntax.SyntaxTree.ListNode;
import io.dataeval.syntax.SyntaxTree.NameNode;
import io.dataeval.syntax.SyntaxTree.Negate;
import io.dataeval.syntax.SyntaxTree.Node;
import io.dataeval.syntax.SyntaxTree.NoneLiteral;
import io.dataeval.syntax.SyntaxTree.NumberLiteral;
import io.dataeval.syntax.SyntaxTree.StringLiteral;
import io.dataeval.syntax.SyntaxTree.TupleNode;
import io.dataeval.syntax.SyntaxTree.UnaryOpNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the literal language.
 *
 * <p>Grammar:
 *
 * <pre>
 * source   := expr (',' expr)* [','] EOF
 * expr     := operand (binop operand)*
 * operand  := 'None' | 'True' | 'False' | NUMBER | '-' NUMBER | STRING+
 *           | ('+' | '~') operand
 *           | '[' [expr (',' expr)* [',']] ']'
 *           | '(' ')' | '(' expr ')' | '(' expr ',' [expr (',' expr)* [',']] ')'
 *           | '{' [expr ':' expr (',' expr ':' expr)* [',']] '}'
 *           | IDENT | IDENT ('.' IDENT)* '(' [arg (',' arg)* [',']] ')'
 * arg      := expr | IDENT '=' expr
 * </pre>
 *
 * <p>Operators are accepted here only so the evaluator can reject them as unsafe constructs;
 * they carry no precedence and are never evaluated. A top-level comma list is a tuple. Nesting is
 * bounded by a configurable depth so pathological input cannot exhaust the stack.
 */
public final class Parser {
  public static final int DEFAULT_MAX_DEPTH = 100;

  private final List<Token> tokens;
  private final int maxDepth;
  private int pos = 0;
  private int depth = 0;

  private Parser(List<Token> tokens, int maxDepth) {
    this.tokens = tokens;
    this.maxDepth = maxDepth;
  }

  /**
   * Parses source text with the default nesting limit.
   *
   * @param source the source text
   * @return the root node
   * @throws EvalSyntaxException if the text does not match the grammar
   */
  public static Node parse(String source) {
    return parse(Lexer.tokenize(source), DEFAULT_MAX_DEPTH);
  }

  /**
   * Parses a token sequence produced by {@link Lexer#tokenize(String)}.
   *
   * @param tokens tokens ending with {@link TokenType#EOF}
   * @param maxDepth maximum nesting depth of operands
   * @return the root node
   * @throws EvalSyntaxException if the tokens do not match the grammar
   */
  public static Node parse(List<Token> tokens, int maxDepth) {
    if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
      throw new IllegalArgumentException("Token sequence must end with EOF");
    }
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
    }
    return new Parser(List.copyOf(tokens), maxDepth).parseSource();
  }

  private Node parseSource() {
    Token first = peek();
    if (first.is(TokenType.EOF)) {
      throw new EvalSyntaxException("Empty expression", first.position());
    }
    Node result = parseExpression();
    if (peek().is(TokenType.COMMA)) {
      List<Node> elements = new ArrayList<>();
      elements.add(result);
      while (match(TokenType.COMMA) && !peek().is(TokenType.EOF)) {
        elements.add(parseExpression());
      }
      result = new TupleNode(elements, first.position());
    }
    if (!peek().is(TokenType.EOF)) {
      throw unexpected(peek());
    }
    return result;
  }

  private Node parseExpression() {
    Node left = parseOperand();
    while (isBinaryOperator(peek())) {
      Token op = next();
      Node right = parseOperand();
      left = new BinaryOpNode(op.text(), left, right, op.position());
    }
    return left;
  }

  private Node parseOperand() {
    if (++depth > maxDepth) {
      throw new EvalSyntaxException(
          "Expression nested too deeply (limit " + maxDepth + ")", peek().position());
    }
    try {
      return parseOperandAtDepth();
    } finally {
      depth--;
    }
  }

  private Node parseOperandAtDepth() {
    Token t = peek();
    switch (t.type()) {
      case NUMBER:
        next();
        return number(t);
      case STRING:
        return parseStrings();
      case MINUS:
        next();
        if (!peek().is(TokenType.NUMBER)) {
          throw new EvalSyntaxException(
              "Negation is only supported on numeric literals", t.position());
        }
        return new Negate(number(next()), t.position());
      case OPERATOR:
        if (t.text().equals("+") || t.text().equals("~")) {
          next();
          return new UnaryOpNode(t.text(), parseOperand(), t.position());
        }
        throw unexpected(t);
      case LBRACKET:
        return parseList();
      case LPAREN:
        return parseParenthesized();
      case LBRACE:
        return parseDict();
      case IDENTIFIER:
        return parseName();
      default:
        throw unexpected(t);
    }
  }

  private Node parseStrings() {
    Token first = next();
    if (!peek().is(TokenType.STRING)) {
      return new StringLiteral(first.text(), first.position());
    }
    StringBuilder sb = new StringBuilder(first.text());
    while (peek().is(TokenType.STRING)) {
      sb.append(next().text());
    }
    return new StringLiteral(sb.toString(), first.position());
  }

  private Node parseList() {
    Token open = next();
    List<Node> elements = new ArrayList<>();
    while (!match(TokenType.RBRACKET)) {
      elements.add(parseExpression());
      if (!match(TokenType.COMMA)) {
        expect(TokenType.RBRACKET, "Expected ',' or ']' in list");
        break;
      }
    }
    return new ListNode(elements, open.position());
  }

  private Node parseParenthesized() {
    Token open = next();
    if (match(TokenType.RPAREN)) {
      return new TupleNode(List.of(), open.position());
    }
    Node first = parseExpression();
    if (match(TokenType.RPAREN)) {
      // grouping, not a tuple
      return first;
    }
    expect(TokenType.COMMA, "Expected ',' or ')'");
    List<Node> elements = new ArrayList<>();
    elements.add(first);
    while (!match(TokenType.RPAREN)) {
      elements.add(parseExpression());
      if (!match(TokenType.COMMA)) {
        expect(TokenType.RPAREN, "Expected ',' or ')' in tuple");
        break;
      }
    }
    return new TupleNode(elements, open.position());
  }

  private Node parseDict() {
    Token open = next();
    List<DictEntry> entries = new ArrayList<>();
    while (!match(TokenType.RBRACE)) {
      Node key = parseExpression();
      expect(TokenType.COLON, "Expected ':' after dict key");
      Node value = parseExpression();
      entries.add(new DictEntry(key, value));
      if (!match(TokenType.COMMA)) {
        expect(TokenType.RBRACE, "Expected ',' or '}' in dict");
        break;
      }
    }
    return new DictNode(entries, open.position());
  }

  private Node parseName() {
    Token ident = next();
    if (!peek().is(TokenType.LPAREN) && !peek().is(TokenType.DOT)) {
      return switch (ident.text()) {
        case "None" -> new NoneLiteral(ident.position());
        case "True" -> new BoolLiteral(true, ident.position());
        case "False" -> new BoolLiteral(false, ident.position());
        default -> new NameNode(ident.text(), ident.position());
      };
    }
    StringBuilder callee = new StringBuilder(ident.text());
    while (peek().is(TokenType.DOT)) {
      Token dot = next();
      if (!peek().is(TokenType.IDENTIFIER)) {
        throw new EvalSyntaxException("Expected identifier after '.'", peek().position());
      }
      callee.append('.').append(next().text());
      if (!peek().is(TokenType.DOT) && !peek().is(TokenType.LPAREN)) {
        throw new EvalSyntaxException("Attribute access is not supported", dot.position());
      }
    }
    return parseCall(callee.toString(), ident.position());
  }

  private Node parseCall(String callee, Position position) {
    next(); // (
    List<Node> args = new ArrayList<>();
    List<KeywordArg> keywords = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    while (!match(TokenType.RPAREN)) {
      if (peek().is(TokenType.IDENTIFIER) && peekAt(1).is(TokenType.EQUALS)) {
        Token name = next();
        next(); // =
        if (!seen.add(name.text())) {
          throw new EvalSyntaxException(
              "Keyword argument repeated: " + name.text(), name.position());
        }
        keywords.add(new KeywordArg(name.text(), parseExpression(), name.position()));
      } else {
        Token start = peek();
        Node arg = parseExpression();
        if (!keywords.isEmpty()) {
          throw new EvalSyntaxException(
              "Positional argument follows keyword argument", start.position());
        }
        args.add(arg);
      }
      if (!match(TokenType.COMMA)) {
        expect(TokenType.RPAREN, "Expected ',' or ')' in call arguments");
        break;
      }
    }
    return new CallNode(callee, args, keywords, position);
  }

  // Helpers

  private static NumberLiteral number(Token t) {
    return new NumberLiteral(t.text(), t.isFloat(), t.position());
  }

  private static boolean isBinaryOperator(Token t) {
    return t.is(TokenType.MINUS) || (t.is(TokenType.OPERATOR) && !t.text().equals("~"));
  }

  private Token peek() {
    return peekAt(0);
  }

  private Token peekAt(int ahead) {
    int idx = Math.min(pos + ahead, tokens.size() - 1);
    return tokens.get(idx);
  }

  private Token next() {
    Token t = peek();
    if (!t.is(TokenType.EOF)) {
      pos++;
    }
    return t;
  }

  private boolean match(TokenType type) {
    if (peek().is(type)) {
      next();
      return true;
    }
    return false;
  }

  private void expect(TokenType type, String message) {
    if (!match(type)) {
      Token found = peek();
      throw new EvalSyntaxException(message + ", found " + found.describe(), found.position());
    }
  }

  private static EvalSyntaxException unexpected(Token t) {
    return new EvalSyntaxException("Unexpected " + t.describe(), t.position());
  }
}
