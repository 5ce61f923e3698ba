package io.dataeval.eval;

import io.dataeval.api.ConstructionException;
import io.dataeval.value.BoolValue;
import io.dataeval.value.DateTimeValue;
import io.dataeval.value.DurationValue;
import io.dataeval.value.FloatValue;
import io.dataeval.value.IntValue;
import io.dataeval.value.NoneValue;
import io.dataeval.value.Value;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The standard {@code datetime} and {@code timedelta} constructors.
 *
 * <p>Arguments bind by position first, then by keyword, the way a conventional keyword-capable
 * constructor does. All failures are reported as {@link ConstructionException} with the
 * constructor name as descriptor.
 */
final class DateTimeCallables {
  static final int MIN_YEAR = 1;
  static final int MAX_YEAR = 9999;
  static final long MAX_DELTA_DAYS = 999_999_999L;

  private static final List<String> DATETIME_PARAMS =
      List.of("year", "month", "day", "hour", "minute", "second", "microsecond", "tzinfo");
  private static final List<String> TIMEDELTA_PARAMS =
      List.of("days", "seconds", "microseconds", "milliseconds", "minutes", "hours", "weeks");

  private static final BigInteger MICROS_PER_SECOND = BigInteger.valueOf(1_000_000L);
  private static final BigInteger MICROS_PER_DAY = BigInteger.valueOf(86_400_000_000L);

  // micros per unit, aligned with TIMEDELTA_PARAMS
  private static final long[] TIMEDELTA_FACTORS = {
    86_400_000_000L, 1_000_000L, 1L, 1_000L, 60_000_000L, 3_600_000_000L, 604_800_000_000L
  };

  private DateTimeCallables() {}

  static Value datetime(List<Value> args, Map<String, Value> keywords) {
    Map<String, Value> bound = bind("datetime", DATETIME_PARAMS, 3, args, keywords);

    Value tz = bound.get("tzinfo");
    if (tz != null && !(tz instanceof NoneValue)) {
      throw new ConstructionException(
          "tzinfo must be None, timezones are not supported", "datetime");
    }

    long year = intArg(bound, "year");
    long month = intArg(bound, "month");
    long day = intArg(bound, "day");
    long hour = intArg(bound, "hour");
    long minute = intArg(bound, "minute");
    long second = intArg(bound, "second");
    long microsecond = intArg(bound, "microsecond");

    checkRange("year", year, MIN_YEAR, MAX_YEAR);
    checkRange("month", month, 1, 12);
    int monthLength = YearMonth.of((int) year, (int) month).lengthOfMonth();
    if (day < 1 || day > monthLength) {
      throw new ConstructionException("day is out of range for month", "datetime");
    }
    checkRange("hour", hour, 0, 23);
    checkRange("minute", minute, 0, 59);
    checkRange("second", second, 0, 59);
    checkRange("microsecond", microsecond, 0, 999_999);

    return new DateTimeValue(
        LocalDateTime.of(
            (int) year,
            (int) month,
            (int) day,
            (int) hour,
            (int) minute,
            (int) second,
            (int) microsecond * 1000));
  }

  static Value timedelta(List<Value> args, Map<String, Value> keywords) {
    Map<String, Value> bound = bind("timedelta", TIMEDELTA_PARAMS, 0, args, keywords);

    BigDecimal total = BigDecimal.ZERO;
    for (int i = 0; i < TIMEDELTA_PARAMS.size(); i++) {
      String name = TIMEDELTA_PARAMS.get(i);
      Value v = bound.get(name);
      if (v != null) {
        total = total.add(numberArg(name, v).multiply(BigDecimal.valueOf(TIMEDELTA_FACTORS[i])));
      }
    }
    BigInteger micros = total.setScale(0, RoundingMode.HALF_EVEN).toBigIntegerExact();

    BigInteger days = floorDiv(micros, MICROS_PER_DAY);
    if (days.abs().compareTo(BigInteger.valueOf(MAX_DELTA_DAYS)) > 0) {
      throw new ConstructionException(
          "days=" + days + "; must have magnitude <= " + MAX_DELTA_DAYS, "timedelta");
    }
    BigInteger[] secAndMicros = micros.divideAndRemainder(MICROS_PER_SECOND);
    long seconds = secAndMicros[0].longValueExact();
    long micro = secAndMicros[1].longValueExact();
    return new DurationValue(Duration.ofSeconds(seconds, micro * 1000));
  }

  private static Map<String, Value> bind(
      String function,
      List<String> params,
      int required,
      List<Value> args,
      Map<String, Value> keywords) {
    if (args.size() > params.size()) {
      throw new ConstructionException(
          function
              + "() takes at most "
              + params.size()
              + " arguments ("
              + args.size()
              + " given)",
          function);
    }
    Map<String, Value> bound = new LinkedHashMap<>();
    for (int i = 0; i < args.size(); i++) {
      bound.put(params.get(i), args.get(i));
    }
    for (Map.Entry<String, Value> kw : keywords.entrySet()) {
      String name = kw.getKey();
      int idx = params.indexOf(name);
      if (idx < 0) {
        throw new ConstructionException(
            "'" + name + "' is an invalid keyword argument for " + function + "()", function);
      }
      if (bound.containsKey(name)) {
        throw new ConstructionException(
            "argument for "
                + function
                + "() given by name ('"
                + name
                + "') and position ("
                + (idx + 1)
                + ")",
            function);
      }
      bound.put(name, kw.getValue());
    }
    for (int i = 0; i < required; i++) {
      if (!bound.containsKey(params.get(i))) {
        throw new ConstructionException(
            function
                + "() missing required argument '"
                + params.get(i)
                + "' (pos "
                + (i + 1)
                + ")",
            function);
      }
    }
    return bound;
  }

  private static long intArg(Map<String, Value> bound, String name) {
    Value v = bound.get(name);
    if (v == null) {
      return 0;
    }
    if (v instanceof BoolValue b) {
      return b.value() ? 1 : 0;
    }
    if (v instanceof IntValue i) {
      if (i.value().bitLength() > 63) {
        throw new ConstructionException(name + " is out of range", "datetime");
      }
      return i.value().longValue();
    }
    if (v instanceof FloatValue) {
      throw new ConstructionException(
          "integer argument expected for " + name + ", got float", "datetime");
    }
    throw new ConstructionException(
        "an integer is required for " + name + " (got type " + v.typeName() + ")", "datetime");
  }

  private static BigDecimal numberArg(String name, Value v) {
    if (v instanceof BoolValue b) {
      return b.value() ? BigDecimal.ONE : BigDecimal.ZERO;
    }
    if (v instanceof IntValue i) {
      return new BigDecimal(i.value());
    }
    if (v instanceof FloatValue f) {
      if (!Double.isFinite(f.value())) {
        throw new ConstructionException(
            "cannot convert float " + f.value() + " for " + name, "timedelta");
      }
      return new BigDecimal(f.value());
    }
    throw new ConstructionException(
        "unsupported type for timedelta " + name + " component: " + v.typeName(), "timedelta");
  }

  private static void checkRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new ConstructionException(
          name + " must be in " + min + ".." + max + ", got " + value, "datetime");
    }
  }

  private static BigInteger floorDiv(BigInteger a, BigInteger b) {
    BigInteger[] qr = a.divideAndRemainder(b);
    return qr[1].signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0];
  }
}
