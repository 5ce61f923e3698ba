package io.dataeval.eval;

import io.dataeval.value.Value;
import java.util.List;
import java.util.Map;

/**
 * A constructor that may be invoked from a literal expression.
 *
 * <p>Implementations must be pure: no I/O, no shared mutable state. They receive fully evaluated
 * arguments and return a single value. Invalid arguments should be reported with {@link
 * io.dataeval.api.ConstructionException}; any other runtime exception is wrapped into one by the
 * evaluator.
 */
@FunctionalInterface
public interface LiteralCallable {

  /**
   * Builds a value from evaluated arguments.
   *
   * @param args positional arguments in source order, unmodifiable
   * @param keywords keyword arguments in source order, unmodifiable
   * @return the constructed value, never {@code null}
   */
  Value call(List<Value> args, Map<String, Value> keywords);
}
