package io.dataeval.value;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValuesTest {

  @Test
  void convertsScalarsFromJava() {
    assertEquals(NoneValue.INSTANCE, Values.fromJava(null));
    assertEquals(BoolValue.TRUE, Values.fromJava(true));
    assertEquals(IntValue.of(3), Values.fromJava((byte) 3));
    assertEquals(IntValue.of(3), Values.fromJava(3L));
    assertEquals(new IntValue(BigInteger.TEN.pow(30)), Values.fromJava(BigInteger.TEN.pow(30)));
    assertEquals(FloatValue.of(0.5), Values.fromJava(0.5f));
    assertEquals(FloatValue.of(2.5), Values.fromJava(new BigDecimal("2.5")));
    assertEquals(TextValue.of("x"), Values.fromJava('x'));
    assertEquals(TextValue.of("sb"), Values.fromJava(new StringBuilder("sb")));
    assertEquals(
        new DurationValue(Duration.ofHours(1)), Values.fromJava(Duration.ofHours(1)));
    LocalDateTime now = LocalDateTime.of(2024, 5, 6, 7, 8);
    assertEquals(new DateTimeValue(now), Values.fromJava(now));
  }

  @Test
  void convertsNestedStructuresFromJava() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("name", "x");
    map.put("tags", Arrays.asList("a", null));
    map.put("size", 3);

    DictValue dict = (DictValue) Values.fromJava(map);
    assertEquals(3, dict.size());
    assertEquals(
        ListValue.of(TextValue.of("a"), NoneValue.INSTANCE), dict.get(TextValue.of("tags")));
    assertEquals(
        List.of(TextValue.of("name"), TextValue.of("tags"), TextValue.of("size")),
        new ArrayList<>(dict.entries().keySet()));
  }

  @Test
  void rejectsUnsupportedTypesAndCycles() {
    assertThrows(IllegalArgumentException.class, () -> Values.fromJava(new Object()));
    assertThrows(IllegalArgumentException.class, () -> Values.fromJava(List.of(new int[0])));

    List<Object> cyclic = new ArrayList<>();
    cyclic.add(cyclic);
    var e = assertThrows(IllegalArgumentException.class, () -> Values.fromJava(cyclic));
    assertTrue(e.getMessage().contains("Cyclic"));

    Map<String, Object> self = new HashMap<>();
    self.put("me", self);
    assertThrows(IllegalArgumentException.class, () -> Values.fromJava(self));
  }

  @Test
  void rejectsUnhashableMapKeys() {
    Map<Object, Object> listKey = new HashMap<>();
    listKey.put(List.of(1), 2);
    var e = assertThrows(IllegalArgumentException.class, () -> Values.fromJava(listKey));
    assertTrue(e.getMessage().contains("list"));

    Map<Object, Object> dictKey = new HashMap<>();
    dictKey.put(TupleValue.of(DictValue.empty()), 1);
    assertThrows(IllegalArgumentException.class, () -> Values.fromJava(dictKey));
  }

  @Test
  void mergesNumericallyEqualMapKeys() {
    Map<Object, Object> map = new LinkedHashMap<>();
    map.put(1, "a");
    map.put(1.0, "b");
    map.put(true, "c");
    DictValue dict = (DictValue) Values.fromJava(map);
    assertEquals(1, dict.size());
    assertEquals(TextValue.of("c"), dict.get(IntValue.of(1)));
  }

  @Test
  void canonicalKeysCollapseNumericEquality() {
    assertEquals(IntValue.of(1), Values.hashKey(BoolValue.TRUE));
    assertEquals(IntValue.of(0), Values.hashKey(FloatValue.of(-0.0)));
    assertEquals(FloatValue.of(0.5), Values.hashKey(FloatValue.of(0.5)));
    assertEquals(
        TupleValue.of(IntValue.of(2)), Values.hashKey(TupleValue.of(FloatValue.of(2.0))));
  }

  @Test
  void sharedSubtreesAreNotCycles() {
    List<Object> shared = List.of(1);
    Value v = Values.fromJava(List.of(shared, shared));
    assertEquals(ListValue.of(ListValue.of(IntValue.of(1)), ListValue.of(IntValue.of(1))), v);
  }

  @Test
  void convertsToJava() {
    assertNull(Values.toJava(NoneValue.INSTANCE));
    assertEquals(5L, Values.toJava(IntValue.of(5)));
    BigInteger big = BigInteger.ONE.shiftLeft(70);
    assertEquals(big, Values.toJava(new IntValue(big)));
    assertEquals(
        Arrays.asList(1L, null),
        Values.toJava(TupleValue.of(IntValue.of(1), NoneValue.INSTANCE)));

    Map<Value, Value> entries = new LinkedHashMap<>();
    entries.put(TextValue.of("z"), FloatValue.of(1.0));
    entries.put(TextValue.of("a"), ListValue.of());
    @SuppressWarnings("unchecked")
    Map<Object, Object> map = (Map<Object, Object>) Values.toJava(new DictValue(entries));
    assertEquals(List.of("z", "a"), new ArrayList<>(map.keySet()));
    assertEquals(1.0, map.get("z"));
    assertThrows(UnsupportedOperationException.class, () -> map.put("b", 1));
  }
}
