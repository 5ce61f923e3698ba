package io.dataeval.value;

/** Double precision floating point number. */
public record FloatValue(double value) implements Value {

  public static FloatValue of(double value) {
    return new FloatValue(value);
  }

  public FloatValue negate() {
    return new FloatValue(-value);
  }

  @Override
  public String typeName() {
    return "float";
  }
}
