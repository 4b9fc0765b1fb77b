package com.cultour.query;

/**
 * Page metadata attached to list and search responses. Derived on every call from the total
 * match count and the requested window.
 *
 * @param total number of matching items across all pages
 * @param page 1-based page number
 * @param perPage page size
 * @param totalPages {@code ceil(total / perPage)}
 * @param hasNextPage whether {@code page * perPage < total}
 */
public record Pagination(long total, int page, int perPage, long totalPages, boolean hasNextPage) {

  public static Pagination of(long total, int page, int perPage) {
    long totalPages = perPage <= 0 ? 0 : (total + perPage - 1) / perPage;
    boolean hasNext = (long) page * perPage < total;
    return new Pagination(total, page, perPage, totalPages, hasNext);
  }
}
