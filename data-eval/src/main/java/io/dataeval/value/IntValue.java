package io.dataeval.value;

import java.math.BigInteger;
import java.util.Objects;

/** Arbitrary precision integer. */
public record IntValue(BigInteger value) implements Value {

  public IntValue {
    Objects.requireNonNull(value, "value");
  }

  public static IntValue of(long value) {
    return new IntValue(BigInteger.valueOf(value));
  }

  public IntValue negate() {
    return new IntValue(value.negate());
  }

  @Override
  public String typeName() {
    return "int";
  }
}
