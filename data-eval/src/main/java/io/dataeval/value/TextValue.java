package io.dataeval.value;

import java.util.Objects;

public record TextValue(String value) implements Value {

  public TextValue {
    Objects.requireNonNull(value, "value");
  }

  public static TextValue of(String value) {
    return new TextValue(value);
  }

  @Override
  public String typeName() {
    return "str";
  }
}
