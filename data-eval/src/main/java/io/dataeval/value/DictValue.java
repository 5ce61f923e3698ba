package io.dataeval.value;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered mapping. Iteration follows insertion order; equality ignores order, as for any
 * {@link Map}.
 */
public record DictValue(Map<Value, Value> entries) implements Value {

  public DictValue {
    for (Map.Entry<Value, Value> e : entries.entrySet()) {
      if (e.getKey() == null || e.getValue() == null) {
        throw new NullPointerException("dict entries must not be null");
      }
    }
    entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  public static DictValue empty() {
    return new DictValue(Map.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  public Value get(Value key) {
    return entries.get(key);
  }

  public int size() {
    return entries.size();
  }

  @Override
  public String typeName() {
    return "dict";
  }

  /**
   * Collects entries with mapping-display semantics: keys that compare equal as numbers ({@code
   * 1}, {@code 1.0}, {@code True}; {@code 0.0} and {@code -0.0}) denote the same entry. A later
   * put replaces the value but keeps the key and position of the first one.
   */
  public static final class Builder {
    private final Map<Value, Value> entries = new LinkedHashMap<>();
    private final Map<Value, Value> firstKeys = new HashMap<>();

    private Builder() {}

    public Builder put(Value key, Value value) {
      Value first = firstKeys.putIfAbsent(Values.hashKey(key), key);
      entries.put(first != null ? first : key, value);
      return this;
    }

    public DictValue build() {
      return new DictValue(entries);
    }
  }
}
