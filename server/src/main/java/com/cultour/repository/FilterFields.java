package com.cultour.repository;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * The fields a repository can filter and sort on, each with the value type its filters are
 * compared as. Both backend adapters check filters against this whitelist before translating
 * them, so an unknown field or an operator the field's type cannot support fails the same way
 * on every backend.
 */
public final class FilterFields {

  private final ImmutableMap<String, FilterValue.Type> types;

  private FilterFields(ImmutableMap<String, FilterValue.Type> types) {
    this.types = types;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean contains(String field) {
    return types.containsKey(field);
  }

  /** The declared type of a whitelisted field. */
  @Nonnull
  public FilterValue.Type typeOf(String field) {
    FilterValue.Type type = types.get(field);
    if (type == null) {
      throw new IllegalArgumentException("Unknown field " + field);
    }
    return type;
  }

  /**
   * Checks a filter against the whitelist and converts its value to the field's type.
   *
   * @return the filter with a typed value, or INVALID_ARGUMENT
   */
  @Nonnull
  public StatusOr<FilterOption> resolve(FilterOption filter) {
    Status shape = filter.validate();
    if (shape.isError()) {
      return StatusOr.ofStatus(shape);
    }
    FilterValue.Type type = types.get(filter.field());
    if (type == null) {
      return StatusOr.ofStatus(
          Status.invalidArgument(
              "unknown filter field '" + filter.field() + "'; allowed: " + allowed()));
    }
    if (filter.operator().isTextMatch() && type != FilterValue.Type.STRING) {
      return StatusOr.ofStatus(unsupported(filter));
    }
    if (filter.operator().isOrdering()
        && (type == FilterValue.Type.BOOLEAN || type == FilterValue.Type.UUID)) {
      return StatusOr.ofStatus(unsupported(filter));
    }
    StatusOr<FilterValue> valueOr = filter.value().coerceTo(type);
    if (valueOr.isNotOk()) {
      return StatusOr.ofStatus(valueOr.getStatus().withContext("filter on " + filter.field()));
    }
    return StatusOr.ofValue(
        new FilterOption(filter.field(), filter.operator(), valueOr.getValue()));
  }

  /** Resolves every filter, failing on the first one that does not resolve. */
  @Nonnull
  public StatusOr<List<FilterOption>> resolveAll(List<FilterOption> filters) {
    ImmutableList.Builder<FilterOption> resolved = ImmutableList.builder();
    for (FilterOption filter : filters) {
      StatusOr<FilterOption> filterOr = resolve(filter);
      if (filterOr.isNotOk()) {
        return StatusOr.ofStatus(filterOr.getStatus());
      }
      resolved.add(filterOr.getValue());
    }
    return StatusOr.ofValue(resolved.build());
  }

  /** OK when {@code field} may be sorted on, INVALID_ARGUMENT otherwise. */
  @Nonnull
  public Status checkSortField(String field) {
    if (types.containsKey(field)) {
      return Status.ok();
    }
    return Status.invalidArgument(
        "unknown sort field '" + field + "'; allowed: " + allowed());
  }

  private String allowed() {
    return Joiner.on(", ").join(types.keySet());
  }

  private static Status unsupported(FilterOption filter) {
    return Status.invalidArgument(
        "operator " + filter.operator().token() + " is not supported on field '"
            + filter.field() + "'");
  }

  /** Collects fields in declaration order. */
  public static final class Builder {
    private final ImmutableMap.Builder<String, FilterValue.Type> types = ImmutableMap.builder();

    private Builder() {}

    public Builder field(String name, FilterValue.Type type) {
      types.put(name, type);
      return this;
    }

    public FilterFields build() {
      return new FilterFields(types.buildOrThrow());
    }
  }
}
