package io.dataeval.eval;

import io.dataeval.api.ConstructionException;
import io.dataeval.api.DataEvalException;
import io.dataeval.api.UnsafeSourceException;
import io.dataeval.syntax.SyntaxTree;
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
import io.dataeval.value.BoolValue;
import io.dataeval.value.DictValue;
import io.dataeval.value.FloatValue;
import io.dataeval.value.IntValue;
import io.dataeval.value.ListValue;
import io.dataeval.value.NoneValue;
import io.dataeval.value.TextValue;
import io.dataeval.value.TupleValue;
import io.dataeval.value.Value;
import io.dataeval.value.Values;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a syntax tree into a {@link Value}.
 *
 * <p>Only literal nodes and calls to whitelisted constructors produce values. Bare identifiers
 * other than {@code none}/{@code true}/{@code false}, operators, negation of non-numbers and
 * calls outside the registry are rejected with {@link UnsafeSourceException}. The evaluator holds
 * no state besides its registry and may be shared between threads.
 */
public final class Evaluator implements SyntaxTree.Visitor<Value> {
  private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

  private static final Map<String, Value> NAMED_CONSTANTS =
      Map.of("none", NoneValue.INSTANCE, "true", BoolValue.TRUE, "false", BoolValue.FALSE);

  private final CallableRegistry registry;

  public Evaluator() {
    this(CallableRegistry.standard());
  }

  public Evaluator(CallableRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public CallableRegistry registry() {
    return registry;
  }

  /**
   * Evaluates a tree.
   *
   * @param node the root node
   * @return the value the tree denotes
   * @throws UnsafeSourceException if the tree uses a construct outside the literal language
   * @throws ConstructionException if a whitelisted constructor rejects its arguments
   */
  public Value evaluate(Node node) {
    return node.accept(this);
  }

  @Override
  public Value visitNone(NoneLiteral node) {
    return NoneValue.INSTANCE;
  }

  @Override
  public Value visitBool(BoolLiteral node) {
    return BoolValue.of(node.value());
  }

  @Override
  public Value visitNumber(NumberLiteral node) {
    String digits = node.text().replace("_", "");
    try {
      if (node.isFloat()) {
        return FloatValue.of(Double.parseDouble(digits));
      }
      return new IntValue(parseInteger(digits));
    } catch (NumberFormatException e) {
      throw new UnsafeSourceException("Invalid numeric literal", node.text(), node.position());
    }
  }

  private static BigInteger parseInteger(String digits) {
    if (digits.length() > 2 && digits.charAt(0) == '0') {
      switch (Character.toLowerCase(digits.charAt(1))) {
        case 'x':
          return new BigInteger(digits.substring(2), 16);
        case 'o':
          return new BigInteger(digits.substring(2), 8);
        case 'b':
          return new BigInteger(digits.substring(2), 2);
        default:
          break;
      }
    }
    return new BigInteger(digits);
  }

  @Override
  public Value visitString(StringLiteral node) {
    return TextValue.of(node.value());
  }

  @Override
  public Value visitNegate(Negate node) {
    if (!(node.operand() instanceof NumberLiteral number)) {
      throw new UnsafeSourceException(
          "Negation is only supported on numeric literals", "-", node.position());
    }
    Value value = visitNumber(number);
    if (value instanceof IntValue i) {
      return i.negate();
    }
    return ((FloatValue) value).negate();
  }

  @Override
  public Value visitList(ListNode node) {
    return new ListValue(evaluateAll(node.elements()));
  }

  @Override
  public Value visitTuple(TupleNode node) {
    return new TupleValue(evaluateAll(node.elements()));
  }

  @Override
  public Value visitDict(DictNode node) {
    DictValue.Builder dict = DictValue.builder();
    for (DictEntry entry : node.entries()) {
      Value key = evaluate(entry.key());
      if (!Values.isHashable(key)) {
        throw new UnsafeSourceException(
            "Unhashable dict key", key.typeName(), entry.key().position());
      }
      Value value = evaluate(entry.value());
      dict.put(key, value);
    }
    return dict.build();
  }

  @Override
  public Value visitCall(CallNode node) {
    CallableRegistry.Entry entry =
        registry
            .lookup(node.callee())
            .orElseThrow(
                () ->
                    new UnsafeSourceException(
                        "Callable not allowed", node.callee(), node.position()));

    List<Value> args = evaluateAll(node.args());
    Map<String, Value> keywords = new LinkedHashMap<>();
    for (KeywordArg kw : node.keywords()) {
      keywords.put(kw.name(), evaluate(kw.value()));
    }

    log.trace(
        "Invoking {} with {} positional and {} keyword arguments",
        entry.qualifiedName(),
        args.size(),
        keywords.size());
    Value result;
    try {
      result = entry.callable().call(List.copyOf(args), Collections.unmodifiableMap(keywords));
    } catch (ConstructionException e) {
      throw e.at(node.position());
    } catch (DataEvalException e) {
      throw e;
    } catch (RuntimeException e) {
      String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      throw new ConstructionException(reason, node.callee(), node.position(), e);
    }
    if (result == null) {
      throw new ConstructionException(
          "Callable returned no value", node.callee(), node.position(), null);
    }
    return result;
  }

  @Override
  public Value visitName(NameNode node) {
    Value constant = NAMED_CONSTANTS.get(node.identifier().toLowerCase(Locale.ROOT));
    if (constant == null) {
      throw new UnsafeSourceException("Strings must be quoted", node.identifier(), node.position());
    }
    return constant;
  }

  @Override
  public Value visitBinaryOp(BinaryOpNode node) {
    throw new UnsafeSourceException(
        "Unsupported source construct", node.operator(), node.position());
  }

  @Override
  public Value visitUnaryOp(UnaryOpNode node) {
    throw new UnsafeSourceException(
        "Unsupported source construct", node.operator(), node.position());
  }

  private List<Value> evaluateAll(List<Node> nodes) {
    List<Value> values = new ArrayList<>(nodes.size());
    for (Node n : nodes) {
      values.add(evaluate(n));
    }
    return values;
  }
}
