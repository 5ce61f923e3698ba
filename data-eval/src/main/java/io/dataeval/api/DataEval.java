package io.dataeval.api;

import io.dataeval.eval.CallableRegistry;
import io.dataeval.eval.Evaluator;
import io.dataeval.syntax.Lexer;
import io.dataeval.syntax.Parser;
import io.dataeval.syntax.SyntaxTree.Node;
import io.dataeval.syntax.Token;
import io.dataeval.value.DictValue;
import io.dataeval.value.Value;
import io.dataeval.value.Values;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Safe evaluation of literal data expressions.
 *
 * <p>Instances are immutable and thread-safe. Each call lexes, parses and evaluates the source
 * without touching shared state.
 */
public final class DataEval {
  private static final Logger log = LoggerFactory.getLogger(DataEval.class);

  private final EvalConfig config;
  private final Evaluator evaluator;

  private DataEval(EvalConfig config, CallableRegistry registry) {
    this.config = config;
    this.evaluator = new Evaluator(registry);
  }

  private static final class Holder {
    static final DataEval DEFAULT = create();
  }

  /** Creates an evaluator with the default configuration and the standard whitelist. */
  public static DataEval create() {
    return create(EvalConfig.defaults());
  }

  public static DataEval create(EvalConfig config) {
    return create(config, CallableRegistry.standard());
  }

  /**
   * Creates an evaluator.
   *
   * @param config evaluation settings; a non-null callable set restricts {@code registry}
   * @param registry the whitelist of callables
   * @return a new evaluator
   * @throws IllegalArgumentException if the config names a callable missing from the registry
   */
  public static DataEval create(EvalConfig config, CallableRegistry registry) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(registry, "registry");
    if (config.callables() != null) {
      try {
        registry = registry.restrictTo(config.callables());
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            "Invalid value for " + EvalConfig.CALLABLES_KEY + ": " + e.getMessage(), e);
      }
    }
    return new DataEval(config, registry);
  }

  /**
   * Evaluates a source with the shared default instance.
   *
   * @see #evaluate(Object)
   */
  public static Value eval(Object source) {
    return Holder.DEFAULT.evaluate(source);
  }

  public EvalConfig config() {
    return config;
  }

  public CallableRegistry registry() {
    return evaluator.registry();
  }

  /**
   * Evaluates a literal expression.
   *
   * <p>Text sources are parsed and evaluated. An already-structured mapping ({@link DictValue} or
   * {@link Map}) is passed through as a {@link DictValue}.
   *
   * @param source a {@link CharSequence}, {@link DictValue} or {@link Map}
   * @return the value the source denotes
   * @throws InvalidInputTypeException if the source has any other type, or the map cannot be
   *     converted
   * @throws EvalSyntaxException if the text is not a well-formed expression
   * @throws UnsafeSourceException if the text uses a construct outside the literal language
   * @throws ConstructionException if a whitelisted constructor rejects its arguments
   */
  public Value evaluate(Object source) {
    if (source instanceof DictValue dict) {
      return dict;
    }
    if (source instanceof Map<?, ?> map) {
      try {
        return Values.fromJava(map);
      } catch (IllegalArgumentException e) {
        log.debug("Rejected mapping source: {}", e.getMessage());
        throw new InvalidInputTypeException(
            "Mapping source cannot be converted: " + e.getMessage(), map.getClass().getName());
      }
    }
    if (!(source instanceof CharSequence text)) {
      InvalidInputTypeException e = InvalidInputTypeException.forSource(source);
      log.debug("Rejected source of type {}", e.getContext());
      throw e;
    }
    return evaluateText(normalizeLineEndings(text.toString()));
  }

  private Value evaluateText(String text) {
    try {
      List<Token> tokens = Lexer.tokenize(text);
      log.trace("Lexed {} chars into {} tokens", text.length(), tokens.size());
      Node root = Parser.parse(tokens, config.maxDepth());
      log.trace("Parsed {} node", root.getClass().getSimpleName());
      return evaluator.evaluate(root);
    } catch (DataEvalException e) {
      log.debug("Rejected expression [{}]: {}", e.getErrorCode(), e.getMessage());
      throw e;
    }
  }

  static String normalizeLineEndings(String text) {
    if (text.indexOf('\r') < 0) {
      return text;
    }
    return text.replace("\r\n", "\n").replace('\r', '\n');
  }
}
