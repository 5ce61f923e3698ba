package io.dataeval.syntax;

import java.util.List;
import java.util.Objects;

/**
 * AST model for the literal language.
 *
 * <p>Grammar (see {@link Parser}):
 *
 * <pre>
 * None, True, False            -&gt; NoneLiteral, BoolLiteral
 * 42, 0x2a, -1.5               -&gt; NumberLiteral, Negate(NumberLiteral)
 * 'text' "more"                -&gt; StringLiteral (adjacent strings concatenated)
 * [1, 2], (1,), {'k': 'v'}     -&gt; ListNode, TupleNode, DictNode
 * datetime(2024, 1, 1)         -&gt; CallNode
 * none, TRUE, other            -&gt; NameNode
 * a + 2, ~1                    -&gt; BinaryOpNode, UnaryOpNode (never evaluated)
 * </pre>
 *
 * <p>Nodes are immutable and form a tree: child lists are defensive copies and no node is shared.
 */
public final class SyntaxTree {

  private SyntaxTree() {}

  /** Base interface for all AST nodes. */
  public sealed interface Node
      permits NoneLiteral,
          BoolLiteral,
          NumberLiteral,
          StringLiteral,
          Negate,
          ListNode,
          TupleNode,
          DictNode,
          CallNode,
          NameNode,
          BinaryOpNode,
          UnaryOpNode {

    /** Where this node starts in the source. */
    Position position();

    <R> R accept(Visitor<R> visitor);
  }

  /**
   * One method per node type. Adding a node type breaks every visitor at compile time, so no node
   * kind can slip through evaluation unhandled.
   */
  public interface Visitor<R> {
    R visitNone(NoneLiteral node);

    R visitBool(BoolLiteral node);

    R visitNumber(NumberLiteral node);

    R visitString(StringLiteral node);

    R visitNegate(Negate node);

    R visitList(ListNode node);

    R visitTuple(TupleNode node);

    R visitDict(DictNode node);

    R visitCall(CallNode node);

    R visitName(NameNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitUnaryOp(UnaryOpNode node);
  }

  // === Constants ===

  public record NoneLiteral(Position position) implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNone(this);
    }
  }

  public record BoolLiteral(boolean value, Position position) implements Node {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBool(this);
    }
  }

  /** Numeric literal kept as source text; conversion happens during evaluation. */
  public record NumberLiteral(String text, boolean isFloat, Position position) implements Node {
    public NumberLiteral {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumber(this);
    }
  }

  public record StringLiteral(String value, Position position) implements Node {
    public StringLiteral {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitString(this);
    }
  }

  /** Literal negation: {@code -} applied to an operand that must be a number. */
  public record Negate(Node operand, Position position) implements Node {
    public Negate {
      Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNegate(this);
    }
  }

  // === Containers ===

  public record ListNode(List<Node> elements, Position position) implements Node {
    public ListNode {
      elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitList(this);
    }
  }

  public record TupleNode(List<Node> elements, Position position) implements Node {
    public TupleNode {
      elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTuple(this);
    }
  }

  /** A single {@code key: value} pair of a dict display. */
  public record DictEntry(Node key, Node value) {
    public DictEntry {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
    }
  }

  public record DictNode(List<DictEntry> entries, Position position) implements Node {
    public DictNode {
      entries = List.copyOf(entries);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDict(this);
    }
  }

  // === Names and calls ===

  /** A {@code name=value} argument of a call. */
  public record KeywordArg(String name, Node value, Position position) {
    public KeywordArg {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Call of a named constructor. The callee may be module-qualified, e.g. {@code
   * datetime.timedelta}.
   */
  public record CallNode(
      String callee, List<Node> args, List<KeywordArg> keywords, Position position)
      implements Node {
    public CallNode {
      Objects.requireNonNull(callee, "callee");
      args = List.copyOf(args);
      keywords = List.copyOf(keywords);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCall(this);
    }
  }

  /** Bare identifier. Only none/true/false (any case) evaluate. */
  public record NameNode(String identifier, Position position) implements Node {
    public NameNode {
      Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitName(this);
    }
  }

  // === Rejected constructs ===

  /** Binary operator expression, e.g. {@code a + 2}. Parsed so it can be rejected as unsafe. */
  public record BinaryOpNode(String operator, Node left, Node right, Position position)
      implements Node {
    public BinaryOpNode {
      Objects.requireNonNull(operator, "operator");
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinaryOp(this);
    }
  }

  /** Prefix operator other than literal negation, e.g. {@code ~1}. */
  public record UnaryOpNode(String operator, Node operand, Position position) implements Node {
    public UnaryOpNode {
      Objects.requireNonNull(operator, "operator");
      Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnaryOp(this);
    }
  }
}
