package com.cultour.query;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A page of items with its pagination envelope, the shape returned by list endpoints.
 *
 * @param <T> the item type
 */
public record Page<T>(List<T> items, Pagination pagination) {

  public Page {
    items = ImmutableList.copyOf(items);
  }

  /** Wraps a search result for the window the normalized options describe. */
  public static <T> Page<T> of(SearchResult<T> result, ListOptions options) {
    return new Page<>(
        result.items(), Pagination.of(result.total(), options.page(), options.perPage()));
  }

  /**
   * Cuts the requested window out of an already materialized list. Pages past the end are
   * empty; the pagination still reports the full size.
   */
  public static <T> Page<T> window(List<T> all, int page, int perPage) {
    int from = (int) Math.min((long) Math.max(page - 1, 0) * perPage, all.size());
    int to = (int) Math.min((long) from + perPage, all.size());
    return new Page<>(all.subList(from, to), Pagination.of(all.size(), page, perPage));
  }
}
