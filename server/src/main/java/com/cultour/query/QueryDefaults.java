package com.cultour.query;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Page size and sort defaults applied when normalizing {@link ListOptions}.
 *
 * @param defaultPerPage page size used when the caller asks for less than one item
 * @param maxPerPage upper bound a requested page size is clamped to
 * @param defaultSortBy sort field used when the caller names none
 */
public record QueryDefaults(int defaultPerPage, int maxPerPage, String defaultSortBy) {

  public static final int DEFAULT_PER_PAGE = 10;
  public static final int MAX_PER_PAGE = 100;
  public static final String DEFAULT_SORT_BY = "created_at";

  public QueryDefaults {
    Preconditions.checkArgument(defaultPerPage >= 1, "defaultPerPage must be positive");
    Preconditions.checkArgument(
        maxPerPage >= defaultPerPage, "maxPerPage must not be below defaultPerPage");
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(defaultSortBy), "defaultSortBy must not be empty");
  }

  /** 10 per page, at most 100, newest {@code created_at} first. */
  public static QueryDefaults standard() {
    return new QueryDefaults(DEFAULT_PER_PAGE, MAX_PER_PAGE, DEFAULT_SORT_BY);
  }
}
