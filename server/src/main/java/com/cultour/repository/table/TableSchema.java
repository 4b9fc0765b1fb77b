package com.cultour.repository.table;

import com.cultour.query.FilterValue;
import com.cultour.repository.FilterFields;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * How one table is read: the base SELECT (with its joins), the primary key column, the
 * filterable columns by external field name, and the text columns free-text search covers.
 */
final class TableSchema {

  private final String table;
  private final String selectSql;
  private final String idColumn;
  private final ImmutableMap<String, String> columns;
  private final FilterFields fields;
  private final ImmutableList<String> searchColumns;

  private TableSchema(Builder builder) {
    this.table = Preconditions.checkNotNull(builder.table, "table");
    this.selectSql = Preconditions.checkNotNull(builder.selectSql, "selectSql");
    this.idColumn = Preconditions.checkNotNull(builder.idColumn, "idColumn");
    this.columns = builder.columns.buildOrThrow();
    this.fields = builder.fields.build();
    this.searchColumns = builder.searchColumns.build();
  }

  static Builder builder() {
    return new Builder();
  }

  /** The table name, used for writes. */
  String table() {
    return table;
  }

  /** SELECT ... FROM ... [JOIN ...], without a WHERE clause. */
  String selectSql() {
    return selectSql;
  }

  /** The qualified primary key column, e.g. {@code p.id}. */
  String idColumn() {
    return idColumn;
  }

  /** The qualified column for an external field name. */
  String column(String field) {
    String column = columns.get(field);
    if (column == null) {
      throw new IllegalArgumentException("Unknown column for field " + field);
    }
    return column;
  }

  FilterFields fields() {
    return fields;
  }

  ImmutableList<String> searchColumns() {
    return searchColumns;
  }

  static final class Builder {
    private String table;
    private String selectSql;
    private String idColumn;
    private final ImmutableMap.Builder<String, String> columns = ImmutableMap.builder();
    private final FilterFields.Builder fields = FilterFields.builder();
    private final ImmutableList.Builder<String> searchColumns = ImmutableList.builder();

    Builder table(String table) {
      this.table = table;
      return this;
    }

    Builder select(String selectSql) {
      this.selectSql = selectSql;
      return this;
    }

    Builder idColumn(String idColumn) {
      this.idColumn = idColumn;
      return this;
    }

    Builder column(String field, String column, FilterValue.Type type) {
      columns.put(field, column);
      fields.field(field, type);
      return this;
    }

    Builder searchColumn(String column) {
      searchColumns.add(column);
      return this;
    }

    TableSchema build() {
      return new TableSchema(this);
    }
  }
}
