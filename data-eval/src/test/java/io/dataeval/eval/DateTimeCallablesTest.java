package io.dataeval.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.dataeval.api.ConstructionException;
import io.dataeval.api.UnsafeSourceException;
import io.dataeval.syntax.Parser;
import io.dataeval.value.DateTimeValue;
import io.dataeval.value.DurationValue;
import io.dataeval.value.Value;
import java.time.Duration;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class DateTimeCallablesTest {
  private final Evaluator evaluator = new Evaluator();

  private Value eval(String source) {
    return evaluator.evaluate(Parser.parse(source));
  }

  private LocalDateTime datetime(String source) {
    return ((DateTimeValue) eval(source)).value();
  }

  private Duration timedelta(String source) {
    return ((DurationValue) eval(source)).value();
  }

  private ConstructionException rejected(String source) {
    return assertThrows(ConstructionException.class, () -> eval(source));
  }

  @Test
  void constructsDatetime() {
    assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), datetime("datetime(2024, 1, 1)"));
    assertEquals(
        LocalDateTime.of(2024, 2, 29, 13, 0, 0, 5_000),
        datetime("datetime.datetime(2024, 2, 29, hour=13, microsecond=5)"));
    assertEquals(
        LocalDateTime.of(9999, 12, 31, 23, 59, 59, 999_999_000),
        datetime("datetime(9999, 12, 31, 23, 59, 59, 999999, None)"));
  }

  @Test
  void datetimeAcceptsKeywordsAndBooleans() {
    assertEquals(
        LocalDateTime.of(2020, 1, 1, 0, 0), datetime("datetime(day=True, month=1, year=2020)"));
    assertEquals(LocalDateTime.of(2020, 1, 1, 0, 0), datetime("datetime(2020, 1, 1, tzinfo=None)"));
  }

  @Test
  void rejectsOutOfRangeDatetimeFields() {
    assertEquals("day is out of range for month", rejected("datetime(2023, 2, 29)").getReason());
    assertEquals("month must be in 1..12, got 13", rejected("datetime(2024, 13, 1)").getReason());
    assertEquals("year must be in 1..9999, got 0", rejected("datetime(0, 1, 1)").getReason());
    rejected("datetime(2024, 1, 1, 24)");
    rejected("datetime(2024, 1, 1, microsecond=1000000)");
    rejected("datetime(2024, 1, -1)");
    rejected("datetime(99999999999999999999, 1, 1)");
  }

  @Test
  void rejectsBadDatetimeArguments() {
    assertEquals(
        "datetime() missing required argument 'day' (pos 3)",
        rejected("datetime(2024, 1)").getReason());
    assertEquals(
        "datetime() takes at most 8 arguments (9 given)",
        rejected("datetime(1, 1, 1, 0, 0, 0, 0, None, 0)").getReason());
    assertEquals(
        "argument for datetime() given by name ('year') and position (1)",
        rejected("datetime(2024, 1, 1, year=2023)").getReason());
    assertEquals(
        "'tz' is an invalid keyword argument for datetime()",
        rejected("datetime(2024, 1, 1, tz=None)").getReason());
    rejected("datetime(2024.0, 1, 1)");
    rejected("datetime('2024', 1, 1)");
    rejected("datetime(2024, 1, 1, tzinfo='UTC')");
  }

  @Test
  void constructsTimedelta() {
    assertEquals(Duration.ZERO, timedelta("timedelta()"));
    assertEquals(Duration.ofDays(1), timedelta("timedelta(1)"));
    assertEquals(Duration.ofDays(-1), timedelta("timedelta(days=-1)"));
    assertEquals(Duration.ofDays(8), timedelta("timedelta(days=1, weeks=1)"));
    assertEquals(Duration.ofMinutes(90), timedelta("timedelta(hours=1.5)"));
    assertEquals(
        Duration.ofSeconds(3723, 4_005_000),
        timedelta("timedelta(0, 3, 5, 4, 2, 1)"));
  }

  @Test
  void roundsTimedeltaHalfEven() {
    assertEquals(Duration.ZERO, timedelta("timedelta(microseconds=0.5)"));
    assertEquals(Duration.ofNanos(2_000), timedelta("timedelta(microseconds=1.5)"));
    assertEquals(Duration.ofNanos(-2_000), timedelta("timedelta(microseconds=-2.5)"));
  }

  @Test
  void rejectsOutOfRangeTimedelta() {
    assertEquals(Duration.ofDays(999_999_999), timedelta("timedelta(999999999)"));
    var e = rejected("timedelta(days=1000000000)");
    assertEquals("days=1000000000; must have magnitude <= 999999999", e.getReason());
    rejected("timedelta(days=1e400)");
    rejected("timedelta(seconds='x')");
    rejected("timedelta(fortnights=1)");
  }

  @Test
  void constructionErrorsCarryCallSite() {
    var e = rejected("[1, datetime(2024, 2, 30)]");
    assertEquals("datetime", e.getDescriptor());
    assertEquals(5, e.getPosition().column());
    assertEquals("CONSTRUCTION", e.getErrorCode());
    assertInstanceOf(UnsafeSourceException.class, e);
  }
}
