package com.cultour.query;

import static org.junit.jupiter.api.Assertions.*;

import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import com.cultour.query.FilterValue.Type;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class FilterValueTest {

  @Test
  void coerceStringToDeclaredType() {
    UUID id = UUID.randomUUID();
    assertEquals(
        FilterValue.ofUuid(id),
        FilterValue.ofString(id.toString()).coerceTo(Type.UUID).getValue());
    assertEquals(
        Instant.parse("2024-05-01T10:00:00Z"),
        FilterValue.ofString("2024-05-01T10:00:00Z")
            .coerceTo(Type.TIMESTAMP)
            .getValue()
            .asTimestamp());
    assertEquals(
        Instant.ofEpochMilli(1714557600000L),
        FilterValue.ofString("1714557600000")
            .coerceTo(Type.TIMESTAMP)
            .getValue()
            .asTimestamp());
    assertTrue(
        FilterValue.ofString(" TRUE ").coerceTo(Type.BOOLEAN).getValue().asBoolean());
    BigDecimal number = FilterValue.ofString("12.5").coerceTo(Type.NUMBER).getValue().asNumber();
    assertEquals(0, new BigDecimal("12.5").compareTo(number));
  }

  @Test
  void coerceRejectsUnparseableText() {
    StatusOr<FilterValue> uuid = FilterValue.ofString("abc").coerceTo(Type.UUID);
    StatusOr<FilterValue> time = FilterValue.ofString("yesterday").coerceTo(Type.TIMESTAMP);
    StatusOr<FilterValue> bool = FilterValue.ofString("yes").coerceTo(Type.BOOLEAN);

    assertEquals(StatusCode.INVALID_ARGUMENT, uuid.getStatus().getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, time.getStatus().getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, bool.getStatus().getCode());
  }

  @Test
  void coerceRejectsCrossTypeConversion() {
    StatusOr<FilterValue> result = FilterValue.ofNumber(3).coerceTo(Type.UUID);
    assertEquals(StatusCode.INVALID_ARGUMENT, result.getStatus().getCode());
  }

  @Test
  void coerceListElementByElement() {
    FilterValue list = FilterValue.ofStrings(List.of("1", "2"));
    FilterValue converted = list.coerceTo(Type.NUMBER).getValue();

    assertTrue(converted.isList());
    assertEquals(Type.NUMBER, converted.asList().get(1).type());
    assertTrue(FilterValue.ofStrings(List.of("1", "x")).coerceTo(Type.NUMBER).isNotOk());
  }

  @Test
  void nestedListsAreRejected() {
    FilterValue inner = FilterValue.ofStrings(List.of("a"));
    assertThrows(IllegalArgumentException.class, () -> FilterValue.ofList(List.of(inner)));
  }

  @Test
  void numbersCompareByValue() {
    assertTrue(FilterValue.ofNumber(new BigDecimal("1.0")).matches(FilterValue.ofNumber(1)));
    assertTrue(FilterValue.ofNumber(2).compareTo(FilterValue.ofNumber(10)) < 0);
  }

  @Test
  void comparingDifferentTypesThrows() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FilterValue.ofString("1").compareTo(FilterValue.ofNumber(1)));
  }

  @Test
  void textMatchingIgnoresCase() {
    FilterValue email = FilterValue.ofString("Ana.Putri@Cultour.id");
    assertTrue(email.containsIgnoreCase(FilterValue.ofString("putri")));
    assertTrue(email.startsWithIgnoreCase(FilterValue.ofString("ana")));
    assertTrue(email.endsWithIgnoreCase(FilterValue.ofString("CULTOUR.ID")));
    assertFalse(email.startsWithIgnoreCase(FilterValue.ofString("putri")));
  }
}
