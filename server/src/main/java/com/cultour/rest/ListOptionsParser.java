package com.cultour.rest;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.query.FilterOperator;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterValue;
import com.cultour.query.ListOptions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import io.javalin.http.Context;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@link ListOptions} from query parameters.
 *
 * <ul>
 *   <li>{@code page} and {@code per_page}, or {@code limit} and {@code offset}; the page then
 *       starts at {@code offset / limit + 1}, so {@code offset} must be a multiple of
 *       {@code limit}
 *   <li>{@code sort_by} and {@code sort_order}
 *   <li>{@code search}
 *   <li>{@code filter=field:op:value}, repeatable. {@code in} and {@code not_in} take a
 *       comma-separated list.
 * </ul>
 *
 * Values are passed on as text; the repository converts them to each field's type.
 */
public final class ListOptionsParser {

  private static final Splitter FILTER_SPLITTER = Splitter.on(':').limit(3);
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private ListOptionsParser() {}

  public static StatusOr<ListOptions> parse(Context ctx) {
    return parse(ctx.queryParamMap());
  }

  public static StatusOr<ListOptions> parse(Map<String, List<String>> params) {
    ListOptions.Builder builder = ListOptions.builder();

    StatusOr<Optional<Integer>> pageOr = intParam(params, "page");
    StatusOr<Optional<Integer>> perPageOr = intParam(params, "per_page");
    StatusOr<Optional<Integer>> limitOr = intParam(params, "limit");
    StatusOr<Optional<Integer>> offsetOr = intParam(params, "offset");
    for (StatusOr<Optional<Integer>> or : List.of(pageOr, perPageOr, limitOr, offsetOr)) {
      if (or.isNotOk()) {
        return StatusOr.ofStatus(or.getStatus());
      }
    }

    if (pageOr.getValue().isPresent() || perPageOr.getValue().isPresent()) {
      pageOr.getValue().ifPresent(builder::page);
      perPageOr.getValue().ifPresent(builder::perPage);
    } else if (limitOr.getValue().isPresent()) {
      int limit = limitOr.getValue().get();
      int offset = offsetOr.getValue().orElse(0);
      builder.perPage(limit);
      if (limit > 0 && offset % limit != 0) {
        return StatusOr.ofStatus(
            Status.invalidArgument(
                "offset " + offset + " must be a multiple of limit " + limit));
      }
      if (limit > 0 && offset > 0) {
        builder.page(offset / limit + 1);
      }
    }

    first(params, "sort_by").ifPresent(builder::sortBy);
    first(params, "sort_order").ifPresent(builder::sortOrder);
    first(params, "search").ifPresent(builder::search);

    for (String raw : params.getOrDefault("filter", List.of())) {
      StatusOr<FilterOption> filterOr = parseFilter(raw);
      if (filterOr.isNotOk()) {
        return StatusOr.ofStatus(filterOr.getStatus());
      }
      builder.filter(filterOr.getValue());
    }
    return StatusOr.ofValue(builder.build());
  }

  /** Parses one {@code field:op:value} expression. The value may itself contain colons. */
  static StatusOr<FilterOption> parseFilter(String raw) {
    List<String> parts = FILTER_SPLITTER.splitToList(Strings.nullToEmpty(raw));
    if (parts.size() != 3) {
      return StatusOr.ofStatus(
          Status.invalidArgument("filter '" + raw + "' must have the form field:op:value"));
    }
    String field = parts.get(0).trim();
    Optional<FilterOperator> operator = FilterOperator.fromToken(parts.get(1));
    if (operator.isEmpty()) {
      return StatusOr.ofStatus(
          Status.invalidArgument("unsupported filter operator '" + parts.get(1) + "'"));
    }
    String value = parts.get(2);
    FilterValue filterValue =
        operator.get().takesList()
            ? FilterValue.ofStrings(LIST_SPLITTER.splitToList(value))
            : FilterValue.ofString(value);
    return StatusOr.ofValue(new FilterOption(field, operator.get(), filterValue));
  }

  private static StatusOr<Optional<Integer>> intParam(
      Map<String, List<String>> params, String name) {
    Optional<String> value = first(params, name);
    if (value.isEmpty()) {
      return StatusOr.ofValue(Optional.empty());
    }
    try {
      return StatusOr.ofValue(Optional.of(Integer.parseInt(value.get().trim())));
    } catch (NumberFormatException e) {
      return StatusOr.ofStatus(
          Status.invalidArgument(name + " must be an integer, got '" + value.get() + "'"));
    }
  }

  private static Optional<String> first(Map<String, List<String>> params, String name) {
    List<String> values = params.get(name);
    if (values == null || values.isEmpty() || Strings.isNullOrEmpty(values.get(0))) {
      return Optional.empty();
    }
    return Optional.of(values.get(0));
  }
}
