package io.dataeval.value;

import java.time.Duration;
import java.util.Objects;

/** Elapsed time, possibly negative. */
public record DurationValue(Duration value) implements Value {

  public DurationValue {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String typeName() {
    return "timedelta";
  }
}
