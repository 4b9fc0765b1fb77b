package com.cultour.query;

import java.util.Locale;
import java.util.Optional;

/** Sort direction of a list query. */
public enum SortOrder {
  ASCENDING("ASC"),
  DESCENDING("DESC");

  private final String sql;

  SortOrder(String sql) {
    this.sql = sql;
  }

  /** The SQL keyword for this direction. */
  public String sql() {
    return sql;
  }

  /**
   * Parses {@code asc}, {@code desc}, {@code ascending} or {@code descending}, ignoring case.
   *
   * @return the direction, or empty for any other token
   */
  public static Optional<SortOrder> parse(String token) {
    if (token == null) {
      return Optional.empty();
    }
    switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "asc":
      case "ascending":
        return Optional.of(ASCENDING);
      case "desc":
      case "descending":
        return Optional.of(DESCENDING);
      default:
        return Optional.empty();
    }
  }
}
