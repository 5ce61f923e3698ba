package io.dataeval.api;

import static org.junit.jupiter.api.Assertions.*;

import io.dataeval.value.DateTimeValue;
import io.dataeval.value.DictValue;
import io.dataeval.value.DurationValue;
import io.dataeval.value.IntValue;
import io.dataeval.value.ListValue;
import io.dataeval.value.TextValue;
import io.dataeval.value.Value;
import io.dataeval.value.Values;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DataEvalTest {

  private static DictValue dict(Object... keysAndValues) {
    Map<Value, Value> entries = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      entries.put(Values.fromJava(keysAndValues[i]), Values.fromJava(keysAndValues[i + 1]));
    }
    return new DictValue(entries);
  }

  @Test
  void evaluatesDictSpreadOverCrlfLines() {
    assertEquals(dict("foo", 1), DataEval.eval("\r\n{\r\n'foo'\r\n:\r\n1\r\n}\r\n"));
  }

  @Test
  void lineEndingsDoNotChangeResult() {
    String lf = "\n{\n'foo'\n:\n[1,\n2]\n}\n";
    Value expected = DataEval.eval(lf);
    assertEquals(expected, DataEval.eval(lf.replace("\n", "\r\n")));
    assertEquals(expected, DataEval.eval(lf.replace("\n", "\r")));
  }

  @Test
  void normalizesCarriageReturnsInsideStrings() {
    assertEquals(TextValue.of("a\nb\nc"), DataEval.eval("'''a\r\nb\rc'''"));
  }

  @Test
  void passesMappingsThrough() {
    DictValue already = dict("k", List.of(1, 2));
    assertSame(already, DataEval.eval(already));

    Map<String, Object> plain = new LinkedHashMap<>();
    plain.put("k", List.of(1, 2));
    assertEquals(already, DataEval.eval(plain));
  }

  @Test
  void rejectsNonTextSources() {
    var number = assertThrows(InvalidInputTypeException.class, () -> DataEval.eval(1));
    assertEquals("INVALID_INPUT", number.getErrorCode());
    assertEquals("java.lang.Integer", number.getContext());
    assertThrows(InvalidInputTypeException.class, () -> DataEval.eval(null));
    assertThrows(InvalidInputTypeException.class, () -> DataEval.eval(List.of("[1]")));
    assertThrows(
        InvalidInputTypeException.class, () -> DataEval.eval(Map.of("k", new Object())));
    assertThrows(
        InvalidInputTypeException.class, () -> DataEval.eval(Map.of(List.of(1), 2)));
  }

  @Test
  void acceptsAnyCharSequence() {
    assertEquals(ListValue.of(IntValue.of(1)), DataEval.eval(new StringBuilder("[1]")));
  }

  @Test
  void rejectsBareIdentifierAsUnsafe() {
    var e = assertThrows(UnsafeSourceException.class, () -> DataEval.eval("a"));
    assertEquals("a", e.getDescriptor());
    assertEquals("UNSAFE", e.getErrorCode());
  }

  @Test
  void rejectsCodeAsUnsafe() {
    assertThrows(UnsafeSourceException.class, () -> DataEval.eval("a+2"));
    assertThrows(UnsafeSourceException.class, () -> DataEval.eval("eval()"));
    assertThrows(UnsafeSourceException.class, () -> DataEval.eval("__import__('os')"));
  }

  @Test
  void rejectsMalformedTextAsSyntaxError() {
    var colon = assertThrows(EvalSyntaxException.class, () -> DataEval.eval(":"));
    assertEquals("SYNTAX", colon.getErrorCode());
    assertTrue(colon.getMessage().endsWith("[Context: line 1, column 1] [Error Code: SYNTAX]"));
    assertThrows(EvalSyntaxException.class, () -> DataEval.eval("import os"));
    assertThrows(EvalSyntaxException.class, () -> DataEval.eval(""));
    assertThrows(EvalSyntaxException.class, () -> DataEval.eval("lambda: 1"));
    assertThrows(EvalSyntaxException.class, () -> DataEval.eval("x = 1"));
  }

  @Test
  void constructsDates() {
    assertEquals(
        new DateTimeValue(LocalDateTime.of(2024, 1, 1, 0, 0)),
        DataEval.eval("datetime(2024, 1, 1)"));
    assertEquals(
        dict("ttl", Duration.ofMinutes(5)),
        DataEval.eval("{'ttl': datetime.timedelta(minutes=5)}"));
    assertThrows(ConstructionException.class, () -> DataEval.eval("datetime(2024, 1, 32)"));
  }

  @Test
  void appliesCallableRestriction() {
    DataEval restricted = DataEval.create(new EvalConfig(100, Set.of("timedelta")));
    assertEquals(
        new DurationValue(Duration.ofDays(2)), restricted.evaluate("timedelta(2)"));
    var e =
        assertThrows(
            UnsafeSourceException.class, () -> restricted.evaluate("datetime(2024, 1, 1)"));
    assertEquals("datetime", e.getDescriptor());

    var unknown =
        assertThrows(
            IllegalArgumentException.class,
            () -> DataEval.create(EvalConfig.defaults().withCallables(Set.of("system"))));
    assertTrue(unknown.getMessage().contains(EvalConfig.CALLABLES_KEY));
  }

  @Test
  void appliesDepthLimit() {
    DataEval shallow = DataEval.create(EvalConfig.defaults().withMaxDepth(2));
    assertEquals(ListValue.of(IntValue.of(1)), shallow.evaluate("[1]"));
    var e = assertThrows(EvalSyntaxException.class, () -> shallow.evaluate("[[1]]"));
    assertTrue(e.getMessage().startsWith("Expression nested too deeply (limit 2)"));
  }

  @Test
  void instancesAreIndependent() {
    DataEval first = DataEval.create();
    DataEval second = DataEval.create(EvalConfig.defaults());
    assertEquals(first.evaluate("{'a': (1,)}"), second.evaluate("{'a': (1,)}"));
    assertEquals(EvalConfig.defaults(), first.config());
    assertEquals(Set.of("datetime", "timedelta"), first.registry().names());
  }
}
