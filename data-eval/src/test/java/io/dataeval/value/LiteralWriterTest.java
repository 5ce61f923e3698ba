package io.dataeval.value;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LiteralWriterTest {

  @Test
  void writesScalars() {
    assertEquals("None", LiteralWriter.write(NoneValue.INSTANCE));
    assertEquals("True", LiteralWriter.write(BoolValue.TRUE));
    assertEquals("False", BoolValue.FALSE.toLiteral());
    assertEquals("-42", LiteralWriter.write(IntValue.of(-42)));
    assertEquals(
        "18446744073709551616",
        LiteralWriter.write(new IntValue(BigInteger.ONE.shiftLeft(64))));
    assertEquals("1.5", LiteralWriter.write(FloatValue.of(1.5)));
    assertEquals("1.0e20", LiteralWriter.write(FloatValue.of(1e20)));
    assertEquals("-0.0", LiteralWriter.write(FloatValue.of(-0.0)));
  }

  @Test
  void rejectsNonFiniteFloats() {
    assertThrows(IllegalArgumentException.class, () -> FloatValue.of(Double.NaN).toLiteral());
    assertThrows(
        IllegalArgumentException.class,
        () -> LiteralWriter.write(ListValue.of(FloatValue.of(Double.NEGATIVE_INFINITY))));
  }

  @Test
  void quotesStrings() {
    assertEquals("'plain'", LiteralWriter.write(TextValue.of("plain")));
    assertEquals("\"it's\"", LiteralWriter.write(TextValue.of("it's")));
    assertEquals("'a\\'b\"c'", LiteralWriter.write(TextValue.of("a'b\"c")));
    assertEquals("'back\\\\slash'", LiteralWriter.write(TextValue.of("back\\slash")));
  }

  @Test
  void escapesControlCharacters() {
    assertEquals("'\\n\\r\\t'", LiteralWriter.write(TextValue.of("\n\r\t")));
    assertEquals("'\\x00\\x7f\\x85'", LiteralWriter.write(TextValue.of("\u0000\u007f\u0085")));
    assertEquals("'café 😀'", LiteralWriter.write(TextValue.of("café 😀")));
    assertEquals("'\\ud800x'", LiteralWriter.write(TextValue.of("\uD800x")));
  }

  @Test
  void writesContainers() {
    assertEquals("[]", LiteralWriter.write(ListValue.of()));
    assertEquals("()", LiteralWriter.write(TupleValue.of()));
    assertEquals("(1,)", LiteralWriter.write(TupleValue.of(IntValue.of(1))));
    assertEquals(
        "(1, 'a')", LiteralWriter.write(TupleValue.of(IntValue.of(1), TextValue.of("a"))));

    Map<Value, Value> entries = new LinkedHashMap<>();
    entries.put(TextValue.of("b"), ListValue.of(BoolValue.TRUE, NoneValue.INSTANCE));
    entries.put(TextValue.of("a"), DictValue.empty());
    assertEquals("{'b': [True, None], 'a': {}}", LiteralWriter.write(new DictValue(entries)));
  }

  @Test
  void writesDatetimes() {
    assertEquals(
        "datetime(2024, 1, 1, 0, 0)",
        LiteralWriter.write(new DateTimeValue(LocalDateTime.of(2024, 1, 1, 0, 0))));
    assertEquals(
        "datetime(2024, 6, 30, 12, 5, 7)",
        LiteralWriter.write(new DateTimeValue(LocalDateTime.of(2024, 6, 30, 12, 5, 7))));
    // sub-microsecond precision is dropped
    assertEquals(
        "datetime(2024, 6, 30, 12, 5, 0, 1234)",
        LiteralWriter.write(
            new DateTimeValue(LocalDateTime.of(2024, 6, 30, 12, 5, 0, 1_234_567))));
  }

  @Test
  void writesTimedeltasInNormalForm() {
    assertEquals("timedelta(0)", LiteralWriter.write(new DurationValue(Duration.ZERO)));
    assertEquals(
        "timedelta(days=-1, seconds=86399)",
        LiteralWriter.write(new DurationValue(Duration.ofSeconds(-1))));
    assertEquals(
        "timedelta(days=1, microseconds=5)",
        LiteralWriter.write(new DurationValue(Duration.ofDays(1).plusNanos(5_000))));
    assertEquals(
        "timedelta(seconds=90)", LiteralWriter.write(new DurationValue(Duration.ofSeconds(90))));
  }
}
