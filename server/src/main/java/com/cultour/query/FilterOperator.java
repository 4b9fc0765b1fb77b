package com.cultour.query;

import java.util.Arrays;
import java.util.Optional;

/** Comparison operators a {@link FilterOption} can apply. */
public enum FilterOperator {
  EQUAL("eq"),
  NOT_EQUAL("ne"),
  GREATER_THAN("gt"),
  LESS_THAN("lt"),
  GREATER_EQUAL("gte"),
  LESS_EQUAL("lte"),
  IN("in"),
  NOT_IN("not_in"),
  LIKE("like"),
  STARTS_WITH("starts_with"),
  ENDS_WITH("ends_with");

  private final String token;

  FilterOperator(String token) {
    this.token = token;
  }

  /** The wire token, e.g. {@code not_in}. */
  public String token() {
    return token;
  }

  /** In and NotIn take a list value, every other operator a single value. */
  public boolean takesList() {
    return this == IN || this == NOT_IN;
  }

  /** Like, StartsWith and EndsWith only apply to text. */
  public boolean isTextMatch() {
    return this == LIKE || this == STARTS_WITH || this == ENDS_WITH;
  }

  /** Greater/less comparisons need a type with a natural order. */
  public boolean isOrdering() {
    return this == GREATER_THAN
        || this == LESS_THAN
        || this == GREATER_EQUAL
        || this == LESS_EQUAL;
  }

  public static Optional<FilterOperator> fromToken(String token) {
    if (token == null) {
      return Optional.empty();
    }
    String trimmed = token.trim();
    return Arrays.stream(values()).filter(op -> op.token.equalsIgnoreCase(trimmed)).findFirst();
  }
}
