package io.dataeval.value;

import java.util.List;

/** Ordered sequence with list semantics. */
public record ListValue(List<Value> elements) implements Value {

  public ListValue {
    elements = List.copyOf(elements);
  }

  public static ListValue of(Value... elements) {
    return new ListValue(List.of(elements));
  }

  @Override
  public String typeName() {
    return "list";
  }
}
