package io.dataeval.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Conversions between {@link Value} trees and plain Java objects. */
public final class Values {
  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private Values() {}

  /**
   * Converts a plain Java object graph into a value.
   *
   * <p>Supported: {@code null}, {@link Value}, {@link Boolean}, integral {@link Number}s and
   * {@link BigInteger}, {@link Float}/{@link Double}/{@link BigDecimal}, {@link CharSequence},
   * {@link Character}, {@link LocalDateTime}, {@link Duration}, {@link List} and {@link Map}.
   *
   * @param object the object to convert
   * @return the equivalent value
   * @throws IllegalArgumentException if the graph contains an unsupported type or a cycle
   */
  public static Value fromJava(Object object) {
    return fromJava(object, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  private static Value fromJava(Object o, Set<Object> inProgress) {
    if (o == null) return NoneValue.INSTANCE;
    if (o instanceof Value v) return v;
    if (o instanceof Boolean b) return BoolValue.of(b);
    if (o instanceof Byte || o instanceof Short || o instanceof Integer || o instanceof Long) {
      return IntValue.of(((Number) o).longValue());
    }
    if (o instanceof BigInteger bi) return new IntValue(bi);
    if (o instanceof Float || o instanceof Double || o instanceof BigDecimal) {
      return FloatValue.of(((Number) o).doubleValue());
    }
    if (o instanceof CharSequence cs) return TextValue.of(cs.toString());
    if (o instanceof Character c) return TextValue.of(String.valueOf(c));
    if (o instanceof LocalDateTime dt) return new DateTimeValue(dt);
    if (o instanceof Duration d) return new DurationValue(d);
    if (o instanceof List<?> list) {
      enter(o, inProgress);
      List<Value> elements = new ArrayList<>(list.size());
      for (Object element : list) {
        elements.add(fromJava(element, inProgress));
      }
      inProgress.remove(o);
      return new ListValue(elements);
    }
    if (o instanceof Map<?, ?> map) {
      enter(o, inProgress);
      DictValue.Builder dict = DictValue.builder();
      for (Map.Entry<?, ?> e : map.entrySet()) {
        Value key = fromJava(e.getKey(), inProgress);
        if (!isHashable(key)) {
          throw new IllegalArgumentException("Unhashable map key of type " + key.typeName());
        }
        dict.put(key, fromJava(e.getValue(), inProgress));
      }
      inProgress.remove(o);
      return dict.build();
    }
    throw new IllegalArgumentException("Unsupported type: " + o.getClass().getName());
  }

  /**
   * Tells whether a value may key a dict. Lists and dicts, also inside tuples, may not.
   *
   * @param key the candidate key
   * @return {@code true} if the value is usable as a dict key
   */
  public static boolean isHashable(Value key) {
    if (key instanceof ListValue || key instanceof DictValue) {
      return false;
    }
    if (key instanceof TupleValue t) {
      for (Value element : t.elements()) {
        if (!isHashable(element)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Returns the value a dict key is compared by. Booleans and integral floats become the equal
   * {@link IntValue}, so {@code True}, {@code 1} and {@code 1.0} (and {@code 0.0}, {@code -0.0})
   * collapse to one key; tuples are normalised element-wise.
   *
   * @param key a hashable key
   * @return the canonical key
   */
  public static Value hashKey(Value key) {
    if (key instanceof BoolValue b) {
      return IntValue.of(b.value() ? 1 : 0);
    }
    if (key instanceof FloatValue f) {
      double d = f.value();
      if (Double.isFinite(d) && d == Math.rint(d)) {
        return new IntValue(new BigDecimal(d).toBigIntegerExact());
      }
      return key;
    }
    if (key instanceof TupleValue t) {
      List<Value> elements = new ArrayList<>(t.elements().size());
      for (Value element : t.elements()) {
        elements.add(hashKey(element));
      }
      return new TupleValue(elements);
    }
    return key;
  }

  private static void enter(Object container, Set<Object> inProgress) {
    if (!inProgress.add(container)) {
      throw new IllegalArgumentException("Cyclic structure cannot be converted");
    }
  }

  /**
   * Converts a value into plain Java objects.
   *
   * <p>Integers become {@link Long} when they fit and {@link BigInteger} otherwise. Lists and
   * tuples both become unmodifiable {@link List}s, dicts become unmodifiable insertion-ordered
   * {@link Map}s.
   *
   * @param value the value to convert
   * @return the Java representation, {@code null} for {@link NoneValue}
   */
  public static Object toJava(Value value) {
    if (value instanceof NoneValue) return null;
    if (value instanceof BoolValue b) return b.value();
    if (value instanceof IntValue i) {
      BigInteger bi = i.value();
      return bi.compareTo(LONG_MIN) >= 0 && bi.compareTo(LONG_MAX) <= 0
          ? (Object) bi.longValue()
          : bi;
    }
    if (value instanceof FloatValue f) return f.value();
    if (value instanceof TextValue t) return t.value();
    if (value instanceof ListValue l) return toJavaList(l.elements());
    if (value instanceof TupleValue t) return toJavaList(t.elements());
    if (value instanceof DictValue d) {
      Map<Object, Object> map = new LinkedHashMap<>();
      for (Map.Entry<Value, Value> e : d.entries().entrySet()) {
        map.put(toJava(e.getKey()), toJava(e.getValue()));
      }
      return Collections.unmodifiableMap(map);
    }
    if (value instanceof DateTimeValue dt) return dt.value();
    if (value instanceof DurationValue du) return du.value();
    throw new IllegalArgumentException("Unknown value type: " + value);
  }

  private static List<Object> toJavaList(List<Value> elements) {
    List<Object> list = new ArrayList<>(elements.size());
    for (Value element : elements) {
      list.add(toJava(element));
    }
    return Collections.unmodifiableList(list);
  }
}
