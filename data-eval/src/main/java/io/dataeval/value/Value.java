package io.dataeval.value;

/**
 * Result of evaluating a literal expression.
 *
 * <p>All implementations are immutable records with structural equality, so values can be shared
 * freely, compared with {@code equals} and used as dict keys.
 */
public sealed interface Value
    permits NoneValue,
        BoolValue,
        IntValue,
        FloatValue,
        TextValue,
        ListValue,
        TupleValue,
        DictValue,
        DateTimeValue,
        DurationValue {

  /** Returns a short type name used in diagnostics, e.g. {@code int} or {@code dict}. */
  String typeName();

  /**
   * Renders this value as literal source text that evaluates back to an equal value.
   *
   * @see LiteralWriter#write(Value)
   */
  default String toLiteral() {
    return LiteralWriter.write(this);
  }
}
