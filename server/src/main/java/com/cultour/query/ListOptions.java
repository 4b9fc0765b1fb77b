package com.cultour.query;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * A list query: page window, sort, filters and free-text search.
 *
 * <p>Instances are immutable. {@link #normalize(QueryDefaults)} returns a clamped copy and is
 * the only place values are adjusted. A malformed sort order or filter is never corrected. It
 * is reported by {@link #validate()}.
 *
 * @param page 1-based page number
 * @param perPage page size
 * @param sortBy field to sort on, by external name; may be null before normalization
 * @param sortOrder raw sort direction token ({@code asc}/{@code desc}); null or empty means
 *     descending
 * @param filters predicates, all of which must hold
 * @param search free-text token; null or empty means no search
 */
public record ListOptions(
    int page,
    int perPage,
    String sortBy,
    String sortOrder,
    List<FilterOption> filters,
    String search) {

  public ListOptions {
    filters = filters == null ? ImmutableList.of() : ImmutableList.copyOf(filters);
  }

  /** First page with default page size and no filters. */
  public static ListOptions firstPage() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Clamps the page window and fills in the default sort field, then validates.
   *
   * <ul>
   *   <li>{@code page < 1} becomes 1
   *   <li>{@code perPage < 1} becomes {@code defaults.defaultPerPage()}
   *   <li>{@code perPage > defaults.maxPerPage()} becomes the maximum
   *   <li>an empty {@code sortBy} becomes {@code defaults.defaultSortBy()}
   * </ul>
   *
   * @return the normalized options, or INVALID_ARGUMENT listing every problem
   */
  @Nonnull
  public StatusOr<ListOptions> normalize(QueryDefaults defaults) {
    int normalizedPage = Math.max(1, page);
    int normalizedPerPage = perPage;
    if (normalizedPerPage < 1) {
      normalizedPerPage = defaults.defaultPerPage();
    } else if (normalizedPerPage > defaults.maxPerPage()) {
      normalizedPerPage = defaults.maxPerPage();
    }
    String normalizedSortBy =
        Strings.isNullOrEmpty(sortBy) ? defaults.defaultSortBy() : sortBy.trim();
    ListOptions normalized =
        new ListOptions(
            normalizedPage,
            normalizedPerPage,
            normalizedSortBy,
            sortOrder,
            filters,
            Strings.nullToEmpty(search).trim());
    Status status = normalized.validate();
    if (status.isError()) {
      return StatusOr.ofStatus(status);
    }
    return StatusOr.ofValue(normalized);
  }

  /**
   * Checks the sort order token and every filter. All problems are joined into one message.
   */
  @Nonnull
  public Status validate() {
    List<String> problems = new ArrayList<>();
    if (!Strings.isNullOrEmpty(sortOrder) && SortOrder.parse(sortOrder).isEmpty()) {
      problems.add("invalid sort order '" + sortOrder + "': must be asc or desc");
    }
    for (FilterOption filter : filters) {
      problems.addAll(filter.problems());
    }
    if (problems.isEmpty()) {
      return Status.ok();
    }
    return Status.invalidArgument(Joiner.on("; ").join(problems));
  }

  /** The parsed sort direction; descending when unset. Call after {@link #validate()}. */
  @Nonnull
  public SortOrder sortDirection() {
    return SortOrder.parse(sortOrder).orElse(SortOrder.DESCENDING);
  }

  /** Row offset of the first item on this page. */
  public long offset() {
    return (long) (page - 1) * perPage;
  }

  public int limit() {
    return perPage;
  }

  public boolean hasSearch() {
    return !Strings.isNullOrEmpty(search);
  }

  /** Returns a copy with the filters replaced. */
  public ListOptions withFilters(List<FilterOption> newFilters) {
    return new ListOptions(page, perPage, sortBy, sortOrder, newFilters, search);
  }

  /** Builder with the raw, unnormalized defaults: page 1, page size 0 (use default). */
  public static final class Builder {
    private int page = 1;
    private int perPage;
    private String sortBy;
    private String sortOrder;
    private final List<FilterOption> filters = new ArrayList<>();
    private String search;

    private Builder() {}

    public Builder page(int page) {
      this.page = page;
      return this;
    }

    public Builder perPage(int perPage) {
      this.perPage = perPage;
      return this;
    }

    public Builder sortBy(String sortBy) {
      this.sortBy = sortBy;
      return this;
    }

    public Builder sortOrder(String sortOrder) {
      this.sortOrder = sortOrder;
      return this;
    }

    public Builder sortOrder(SortOrder sortOrder) {
      this.sortOrder = sortOrder == SortOrder.ASCENDING ? "asc" : "desc";
      return this;
    }

    public Builder filter(FilterOption filter) {
      this.filters.add(filter);
      return this;
    }

    public Builder filters(List<FilterOption> filters) {
      this.filters.addAll(filters);
      return this;
    }

    public Builder search(String search) {
      this.search = search;
      return this;
    }

    public ListOptions build() {
      return new ListOptions(page, perPage, sortBy, sortOrder, filters, search);
    }
  }
}
