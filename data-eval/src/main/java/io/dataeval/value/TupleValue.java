package io.dataeval.value;

import java.util.List;

/**
 * Ordered sequence with tuple semantics. Never equal to a {@link ListValue} with the same
 * elements.
 */
public record TupleValue(List<Value> elements) implements Value {

  public TupleValue {
    elements = List.copyOf(elements);
  }

  public static TupleValue of(Value... elements) {
    return new TupleValue(List.of(elements));
  }

  @Override
  public String typeName() {
    return "tuple";
  }
}
