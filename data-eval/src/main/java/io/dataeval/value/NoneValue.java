package io.dataeval.value;

/** The null value, written {@code None}. */
public record NoneValue() implements Value {
  public static final NoneValue INSTANCE = new NoneValue();

  @Override
  public String typeName() {
    return "NoneType";
  }
}
