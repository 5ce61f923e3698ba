package io.dataeval.value;

import java.time.LocalDateTime;
import java.util.Objects;

/** Naive (zone-less) calendar date and time of day. */
public record DateTimeValue(LocalDateTime value) implements Value {

  public DateTimeValue {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String typeName() {
    return "datetime";
  }
}
