package io.dataeval.value;

import java.math.BigInteger;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Renders values as literal source text.
 *
 * <p>The output uses the same notation the evaluator accepts: {@code None}, {@code True}, quoted
 * strings with backslash escapes, {@code [..]}, {@code (..)}, {@code {k: v}}, and {@code
 * datetime(..)}/{@code timedelta(..)} calls. Evaluating the output yields a value equal to the
 * input, with two exceptions: non-finite floats have no literal form and are rejected, and
 * date/time values are truncated to microsecond precision.
 */
public final class LiteralWriter {
  private static final BigInteger MICROS_PER_SECOND = BigInteger.valueOf(1_000_000L);
  private static final BigInteger MICROS_PER_DAY = BigInteger.valueOf(86_400_000_000L);

  private LiteralWriter() {}

  /**
   * Renders a value as literal text.
   *
   * @param value the value to render
   * @return the literal text
   * @throws IllegalArgumentException if the value contains a NaN or infinite float
   */
  public static String write(Value value) {
    StringBuilder sb = new StringBuilder();
    append(sb, value);
    return sb.toString();
  }

  private static void append(StringBuilder sb, Value value) {
    if (value instanceof NoneValue) {
      sb.append("None");
    } else if (value instanceof BoolValue b) {
      sb.append(b.value() ? "True" : "False");
    } else if (value instanceof IntValue i) {
      sb.append(i.value());
    } else if (value instanceof FloatValue f) {
      appendFloat(sb, f.value());
    } else if (value instanceof TextValue t) {
      appendString(sb, t.value());
    } else if (value instanceof ListValue l) {
      sb.append('[');
      appendElements(sb, l.elements());
      sb.append(']');
    } else if (value instanceof TupleValue t) {
      sb.append('(');
      appendElements(sb, t.elements());
      if (t.elements().size() == 1) {
        sb.append(',');
      }
      sb.append(')');
    } else if (value instanceof DictValue d) {
      sb.append('{');
      Iterator<Map.Entry<Value, Value>> it = d.entries().entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<Value, Value> e = it.next();
        append(sb, e.getKey());
        sb.append(": ");
        append(sb, e.getValue());
        if (it.hasNext()) {
          sb.append(", ");
        }
      }
      sb.append('}');
    } else if (value instanceof DateTimeValue dt) {
      appendDateTime(sb, dt.value());
    } else if (value instanceof DurationValue du) {
      appendDuration(sb, du.value());
    } else {
      throw new IllegalArgumentException("Unknown value type: " + value);
    }
  }

  private static void appendElements(StringBuilder sb, List<Value> elements) {
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      append(sb, elements.get(i));
    }
  }

  private static void appendFloat(StringBuilder sb, double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      throw new IllegalArgumentException("Float " + d + " has no literal form");
    }
    // Double.toString is round-trip exact and always contains '.' or an exponent
    sb.append(Double.toString(d).replace('E', 'e'));
  }

  static void appendString(StringBuilder sb, String s) {
    char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
    sb.append(quote);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == quote || c == '\\') {
        sb.append('\\').append(c);
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else if (c == '\t') {
        sb.append("\\t");
      } else if (c < 0x20 || (c >= 0x7f && c <= 0x9f)) {
        sb.append(String.format("\\x%02x", (int) c));
      } else if (Character.isSurrogate(c) && !isPairedSurrogate(s, i)) {
        sb.append(String.format("\\u%04x", (int) c));
      } else {
        sb.append(c);
      }
    }
    sb.append(quote);
  }

  private static boolean isPairedSurrogate(String s, int i) {
    char c = s.charAt(i);
    if (Character.isHighSurrogate(c)) {
      return i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1));
    }
    return i > 0 && Character.isHighSurrogate(s.charAt(i - 1));
  }

  private static void appendDateTime(StringBuilder sb, LocalDateTime dt) {
    int micros = dt.getNano() / 1000;
    sb.append("datetime(")
        .append(dt.getYear())
        .append(", ")
        .append(dt.getMonthValue())
        .append(", ")
        .append(dt.getDayOfMonth())
        .append(", ")
        .append(dt.getHour())
        .append(", ")
        .append(dt.getMinute());
    if (dt.getSecond() != 0 || micros != 0) {
      sb.append(", ").append(dt.getSecond());
    }
    if (micros != 0) {
      sb.append(", ").append(micros);
    }
    sb.append(')');
  }

  private static void appendDuration(StringBuilder sb, Duration d) {
    BigInteger total =
        BigInteger.valueOf(d.getSeconds())
            .multiply(MICROS_PER_SECOND)
            .add(BigInteger.valueOf(d.getNano() / 1000));
    BigInteger[] dayRem = floorDivMod(total, MICROS_PER_DAY);
    BigInteger[] secRem = dayRem[1].divideAndRemainder(MICROS_PER_SECOND);

    StringBuilder args = new StringBuilder();
    appendPart(args, "days", dayRem[0]);
    appendPart(args, "seconds", secRem[0]);
    appendPart(args, "microseconds", secRem[1]);
    sb.append("timedelta(").append(args.length() == 0 ? "0" : args).append(')');
  }

  private static void appendPart(StringBuilder args, String name, BigInteger amount) {
    if (amount.signum() == 0) {
      return;
    }
    if (args.length() > 0) {
      args.append(", ");
    }
    args.append(name).append('=').append(amount);
  }

  private static BigInteger[] floorDivMod(BigInteger a, BigInteger b) {
    BigInteger[] qr = a.divideAndRemainder(b);
    if (qr[1].signum() < 0) {
      qr[0] = qr[0].subtract(BigInteger.ONE);
      qr[1] = qr[1].add(b);
    }
    return qr;
  }
}
