package com.cultour.query;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import javax.annotation.Nonnull;

/**
 * A typed filter operand. Values are compared with the comparison of their own type and never
 * by their string forms, so {@code 10} sorts after {@code 9} and timestamps compare
 * chronologically.
 *
 * <p>Text arriving from the HTTP surface starts as {@link Type#STRING} and is converted with
 * {@link #coerceTo(Type)} to the type the filtered field declares.
 */
public final class FilterValue implements Comparable<FilterValue> {

  /** The variants a filter value can take. */
  public enum Type {
    STRING,
    NUMBER,
    BOOLEAN,
    TIMESTAMP,
    UUID,
    LIST
  }

  private final Type type;
  private final Object value;

  private FilterValue(Type type, Object value) {
    this.type = type;
    this.value = Objects.requireNonNull(value, "filter value");
  }

  public static FilterValue ofString(String value) {
    return new FilterValue(Type.STRING, value);
  }

  public static FilterValue ofNumber(BigDecimal value) {
    return new FilterValue(Type.NUMBER, value);
  }

  public static FilterValue ofNumber(long value) {
    return new FilterValue(Type.NUMBER, BigDecimal.valueOf(value));
  }

  public static FilterValue ofBoolean(boolean value) {
    return new FilterValue(Type.BOOLEAN, value);
  }

  public static FilterValue ofTimestamp(Instant value) {
    return new FilterValue(Type.TIMESTAMP, value);
  }

  public static FilterValue ofUuid(UUID value) {
    return new FilterValue(Type.UUID, value);
  }

  /** A list operand for In and NotIn. Elements must be scalar values. */
  public static FilterValue ofList(List<FilterValue> values) {
    for (FilterValue element : values) {
      Preconditions.checkArgument(
          element.type != Type.LIST, "list filter values cannot be nested");
    }
    return new FilterValue(Type.LIST, ImmutableList.copyOf(values));
  }

  /** Convenience for a list of strings, e.g. parsed from {@code role:in:user,admin}. */
  public static FilterValue ofStrings(List<String> values) {
    List<FilterValue> elements = new ArrayList<>(values.size());
    for (String v : values) {
      elements.add(ofString(v));
    }
    return ofList(elements);
  }

  @Nonnull
  public Type type() {
    return type;
  }

  public boolean isList() {
    return type == Type.LIST;
  }

  /** The underlying Java value: String, BigDecimal, Boolean, Instant, UUID or a list. */
  @Nonnull
  public Object raw() {
    return value;
  }

  public String asString() {
    return (String) value;
  }

  public BigDecimal asNumber() {
    return (BigDecimal) value;
  }

  public boolean asBoolean() {
    return (Boolean) value;
  }

  public Instant asTimestamp() {
    return (Instant) value;
  }

  public UUID asUuid() {
    return (UUID) value;
  }

  @SuppressWarnings("unchecked")
  public List<FilterValue> asList() {
    return (List<FilterValue>) value;
  }

  /**
   * Converts this value to {@code target}. A string is parsed into the target type. A list is
   * converted element by element. Any other cross-type conversion is rejected.
   *
   * @return the converted value, or INVALID_ARGUMENT when it cannot be represented
   */
  @Nonnull
  public StatusOr<FilterValue> coerceTo(Type target) {
    if (type == target) {
      return StatusOr.ofValue(this);
    }
    if (type == Type.LIST) {
      List<FilterValue> converted = new ArrayList<>();
      for (FilterValue element : asList()) {
        StatusOr<FilterValue> elementOr = element.coerceTo(target);
        if (elementOr.isNotOk()) {
          return elementOr;
        }
        converted.add(elementOr.getValue());
      }
      return StatusOr.ofValue(ofList(converted));
    }
    if (type != Type.STRING || target == Type.LIST) {
      return StatusOr.ofStatus(
          Status.invalidArgument("cannot compare a " + describe(type) + " with a "
              + describe(target) + " field"));
    }
    String text = asString().trim();
    try {
      switch (target) {
        case NUMBER:
          return StatusOr.ofValue(ofNumber(new BigDecimal(text)));
        case BOOLEAN:
          if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return StatusOr.ofValue(ofBoolean(Boolean.parseBoolean(text)));
          }
          return StatusOr.ofStatus(Status.invalidArgument("'" + text + "' is not a boolean"));
        case TIMESTAMP:
          return StatusOr.ofValue(ofTimestamp(parseInstant(text)));
        case UUID:
          return StatusOr.ofValue(ofUuid(java.util.UUID.fromString(text)));
        default:
          return StatusOr.ofStatus(
              Status.invalidArgument("unsupported filter value type " + describe(target)));
      }
    } catch (IllegalArgumentException | DateTimeParseException e) {
      return StatusOr.ofStatus(
          Status.invalidArgument("'" + text + "' is not a valid " + describe(target)));
    }
  }

  /**
   * Orders two scalar values of the same type.
   *
   * @throws IllegalArgumentException if the types differ or have no order
   */
  @Override
  public int compareTo(FilterValue other) {
    requireSameType(other);
    switch (type) {
      case STRING:
        return asString().compareTo(other.asString());
      case NUMBER:
        return asNumber().compareTo(other.asNumber());
      case BOOLEAN:
        return Boolean.compare(asBoolean(), other.asBoolean());
      case TIMESTAMP:
        return asTimestamp().compareTo(other.asTimestamp());
      case UUID:
        return asUuid().compareTo(other.asUuid());
      default:
        throw new IllegalArgumentException("list values have no order");
    }
  }

  /**
   * Typed equality. Numbers compare by value, so {@code 1.0} equals {@code 1}.
   *
   * @throws IllegalArgumentException if the types differ
   */
  public boolean matches(FilterValue other) {
    requireSameType(other);
    if (type == Type.NUMBER) {
      return asNumber().compareTo(other.asNumber()) == 0;
    }
    return value.equals(other.value);
  }

  /** Case-insensitive substring test on two string values. */
  public boolean containsIgnoreCase(FilterValue needle) {
    return lower(this).contains(lower(needle));
  }

  /** Case-insensitive prefix test on two string values. */
  public boolean startsWithIgnoreCase(FilterValue prefix) {
    return lower(this).startsWith(lower(prefix));
  }

  /** Case-insensitive suffix test on two string values. */
  public boolean endsWithIgnoreCase(FilterValue suffix) {
    return lower(this).endsWith(lower(suffix));
  }

  private static String lower(FilterValue v) {
    Preconditions.checkArgument(v.type == Type.STRING, "text match needs string values");
    return v.asString().toLowerCase(Locale.ROOT);
  }

  private void requireSameType(FilterValue other) {
    if (type != other.type) {
      throw new IllegalArgumentException(
          "cannot compare " + describe(type) + " with " + describe(other.type));
    }
  }

  private static Instant parseInstant(String text) {
    if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
      return Instant.ofEpochMilli(Long.parseLong(text));
    }
    return Instant.parse(text);
  }

  static String describe(Type type) {
    return type.name().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return value.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    FilterValue other = (FilterValue) obj;
    return type == other.type && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }
}
