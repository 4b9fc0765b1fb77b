package com.cultour.repository.table;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.query.FilterOperator;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterValue;
import com.cultour.query.SortOrder;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * The WHERE clause and parameters for one list query, built from resolved filters and an
 * optional search text. The page query and the count query share it, so the total always
 * reflects exactly the filters the page was cut from.
 */
final class TableQuery {

  private final TableSchema schema;
  private final String where;
  private final ImmutableList<Object> params;

  private TableQuery(TableSchema schema, String where, List<Object> params) {
    this.schema = schema;
    this.where = where;
    this.params = ImmutableList.copyOf(params);
  }

  /**
   * Builds the predicate for {@code filters} (already resolved against the schema's fields)
   * and, when {@code search} is non-empty, an OR across the search columns.
   */
  static StatusOr<TableQuery> where(TableSchema schema, List<FilterOption> filters, String search) {
    StringBuilder sql = new StringBuilder(" WHERE 1=1");
    List<Object> params = new ArrayList<>();

    for (FilterOption filter : filters) {
      appendPredicate(sql, params, schema.column(filter.field()), filter);
    }

    if (!Strings.isNullOrEmpty(search)) {
      if (schema.searchColumns().isEmpty()) {
        return StatusOr.ofStatus(
            Status.invalidArgument("free-text search is not supported for " + schema.table()));
      }
      sql.append(" AND (");
      for (int i = 0; i < schema.searchColumns().size(); i++) {
        if (i > 0) {
          sql.append(" OR ");
        }
        sql.append(schema.searchColumns().get(i)).append(" ILIKE ? ESCAPE '\\'");
        params.add("%" + escapeLike(search) + "%");
      }
      sql.append(")");
    }
    return StatusOr.ofValue(new TableQuery(schema, sql.toString(), params));
  }

  /** Counts every matching row, ignoring any page window. */
  String countSql() {
    return "SELECT COUNT(*) FROM (" + schema.selectSql() + where + ") AS filtered";
  }

  /**
   * Selects matching rows in the given order, with the primary key as tie-breaker. When
   * {@code paged} is true the statement ends in {@code LIMIT ? OFFSET ?}, bound by
   * {@link #pageParams(int, long)}.
   */
  String selectSql(String sortField, SortOrder direction, boolean paged) {
    StringBuilder sql = new StringBuilder(schema.selectSql()).append(where);
    sql.append(" ORDER BY ")
        .append(schema.column(sortField))
        .append(' ')
        .append(direction.sql())
        .append(", ")
        .append(schema.idColumn())
        .append(' ')
        .append(direction.sql());
    if (paged) {
      sql.append(" LIMIT ? OFFSET ?");
    }
    return sql.toString();
  }

  /** Parameters of the WHERE clause. */
  ImmutableList<Object> params() {
    return params;
  }

  /** WHERE parameters followed by LIMIT and OFFSET. */
  List<Object> pageParams(int limit, long offset) {
    List<Object> all = new ArrayList<>(params);
    all.add(limit);
    all.add(offset);
    return all;
  }

  private static void appendPredicate(
      StringBuilder sql, List<Object> params, String column, FilterOption filter) {
    FilterValue value = filter.value();
    switch (filter.operator()) {
      case EQUAL:
        sql.append(" AND ").append(column).append(" = ?");
        params.add(value.raw());
        break;
      case NOT_EQUAL:
        sql.append(" AND ").append(column).append(" <> ?");
        params.add(value.raw());
        break;
      case GREATER_THAN:
        sql.append(" AND ").append(column).append(" > ?");
        params.add(value.raw());
        break;
      case LESS_THAN:
        sql.append(" AND ").append(column).append(" < ?");
        params.add(value.raw());
        break;
      case GREATER_EQUAL:
        sql.append(" AND ").append(column).append(" >= ?");
        params.add(value.raw());
        break;
      case LESS_EQUAL:
        sql.append(" AND ").append(column).append(" <= ?");
        params.add(value.raw());
        break;
      case IN:
      case NOT_IN:
        appendMembership(sql, params, column, filter);
        break;
      case LIKE:
        sql.append(" AND ").append(column).append(" ILIKE ? ESCAPE '\\'");
        params.add("%" + escapeLike(value.asString()) + "%");
        break;
      case STARTS_WITH:
        sql.append(" AND ").append(column).append(" ILIKE ? ESCAPE '\\'");
        params.add(escapeLike(value.asString()) + "%");
        break;
      case ENDS_WITH:
        sql.append(" AND ").append(column).append(" ILIKE ? ESCAPE '\\'");
        params.add("%" + escapeLike(value.asString()));
        break;
      default:
        throw new IllegalStateException("Unhandled operator " + filter.operator());
    }
  }

  private static void appendMembership(
      StringBuilder sql, List<Object> params, String column, FilterOption filter) {
    List<FilterValue> values = filter.value().asList();
    boolean negate = filter.operator() == FilterOperator.NOT_IN;
    if (values.isEmpty()) {
      // Nothing is in an empty set; NULL stays excluded either way.
      sql.append(" AND ").append(negate ? column + " IS NOT NULL" : "FALSE");
      return;
    }
    sql.append(" AND ").append(column).append(negate ? " NOT IN (" : " IN (");
    for (int i = 0; i < values.size(); i++) {
      sql.append(i == 0 ? "?" : ", ?");
      params.add(values.get(i).raw());
    }
    sql.append(")");
  }

  /** Escapes the LIKE wildcards so user text only ever matches literally. */
  static String escapeLike(String text) {
    return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
