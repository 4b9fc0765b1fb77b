package com.cultour.repository.table;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.db.util.DbUtil;
import com.cultour.query.FilterOperator;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterValue;
import com.cultour.query.ListOptions;
import com.cultour.query.QueryDefaults;
import com.cultour.query.SearchResult;
import com.cultour.query.SortOrder;
import com.cultour.repository.Repository;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.sql.DataSource;

/**
 * {@link Repository} over one PostgreSQL table. Filters, sorting and the page window are
 * translated into SQL and evaluated by the database. Totals come from a separate
 * {@code COUNT(*)} over the same WHERE clause, executed before the page is read.
 *
 * <p>Subclasses describe the table with a {@link TableSchema} and supply the row mapping and
 * the INSERT and UPDATE statements.
 *
 * @param <W> the write model
 * @param <R> the read model
 */
public abstract class TableRepository<W, R> implements Repository<W, R> {

  private final DataSource dataSource;
  private final QueryDefaults defaults;
  private final TableSchema schema;
  private final String entityName;

  TableRepository(
      DataSource dataSource, QueryDefaults defaults, TableSchema schema, String entityName) {
    this.dataSource = dataSource;
    this.defaults = defaults;
    this.schema = schema;
    this.entityName = entityName;
  }

  /** Maps the current row of a result set produced by the schema's SELECT. */
  protected abstract StatusOr<R> extract(ResultSet rs);

  /** Inserts a row with the given id and timestamps. */
  protected abstract void insertRow(Connection conn, UUID id, W value, Instant now)
      throws SQLException;

  /** Overwrites the mutable columns of a row and returns the number of rows updated. */
  protected abstract int updateRow(Connection conn, UUID id, W value, Instant now)
      throws SQLException;

  @Nonnull
  @Override
  public StatusOr<R> create(W value) {
    UUID id = UUID.randomUUID();
    try (Connection conn = dataSource.getConnection()) {
      insertRow(conn, id, value, Instant.now());
      return loadById(conn, id);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.statusFromSqlException(e, "create " + entityName));
    }
  }

  @Nonnull
  @Override
  public StatusOr<R> findById(UUID id) {
    try (Connection conn = dataSource.getConnection()) {
      return loadById(conn, id);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.statusFromSqlException(e, "load " + entityName));
    }
  }

  @Nonnull
  @Override
  public StatusOr<R> update(UUID id, W value) {
    try (Connection conn = dataSource.getConnection()) {
      int updated = updateRow(conn, id, value, Instant.now());
      if (updated == 0) {
        return StatusOr.ofStatus(Status.notFound(entityName + " not found: " + id));
      }
      return loadById(conn, id);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.statusFromSqlException(e, "update " + entityName));
    }
  }

  @Nonnull
  @Override
  public Status delete(UUID id) {
    String sql = "DELETE FROM " + schema.table() + " WHERE id = ?";
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      if (stmt.executeUpdate() == 0) {
        return Status.notFound(entityName + " not found: " + id);
      }
      return Status.ok();
    } catch (SQLException e) {
      return DbUtil.statusFromSqlException(e, "delete " + entityName);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Boolean> exists(UUID id) {
    return existsWhere("id = ?", List.of(id));
  }

  @Nonnull
  @Override
  public StatusOr<List<R>> findByField(String field, FilterValue value) {
    return findWhere(
        List.of(new FilterOption(field, FilterOperator.EQUAL, value)),
        defaults.defaultSortBy(),
        SortOrder.DESCENDING,
        0);
  }

  @Nonnull
  @Override
  public StatusOr<List<R>> list(ListOptions options) {
    StatusOr<PreparedQuery> queryOr = prepare(options);
    if (queryOr.isNotOk()) {
      return StatusOr.ofStatus(queryOr.getStatus());
    }
    PreparedQuery query = queryOr.getValue();
    try (Connection conn = dataSource.getConnection()) {
      return readPage(conn, query);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.statusFromSqlException(e, "list " + entityName));
    }
  }

  @Nonnull
  @Override
  public StatusOr<Long> count(List<FilterOption> filters) {
    StatusOr<List<FilterOption>> resolvedOr = schema.fields().resolveAll(filters);
    if (resolvedOr.isNotOk()) {
      return StatusOr.ofStatus(resolvedOr.getStatus());
    }
    StatusOr<TableQuery> whereOr = TableQuery.where(schema, resolvedOr.getValue(), null);
    if (whereOr.isNotOk()) {
      return StatusOr.ofStatus(whereOr.getStatus());
    }
    try (Connection conn = dataSource.getConnection()) {
      return StatusOr.ofValue(countRows(conn, whereOr.getValue()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.statusFromSqlException(e, "count " + entityName));
    }
  }

  @Nonnull
  @Override
  public StatusOr<SearchResult<R>> search(ListOptions options) {
    StatusOr<PreparedQuery> queryOr = prepare(options);
    if (queryOr.isNotOk()) {
      return StatusOr.ofStatus(queryOr.getStatus());
    }
    PreparedQuery query = queryOr.getValue();
    try (Connection conn = dataSource.getConnection()) {
      // Total first, over the unwindowed WHERE clause.
      long total = countRows(conn, query.where());
      StatusOr<List<R>> pageOr = readPage(conn, query);
      if (pageOr.isNotOk()) {
        return StatusOr.ofStatus(pageOr.getStatus());
      }
      return StatusOr.ofValue(new SearchResult<>(pageOr.getValue(), total));
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.statusFromSqlException(e, "search " + entityName));
    }
  }

  /**
   * Every row matching {@code filters}, sorted on {@code sortField}. A positive {@code limit}
   * caps the number of rows.
   */
  protected StatusOr<List<R>> findWhere(
      List<FilterOption> filters, String sortField, SortOrder direction, int limit) {
    StatusOr<List<FilterOption>> resolvedOr = schema.fields().resolveAll(filters);
    if (resolvedOr.isNotOk()) {
      return StatusOr.ofStatus(resolvedOr.getStatus());
    }
    Status sortStatus = schema.fields().checkSortField(sortField);
    if (sortStatus.isError()) {
      return StatusOr.ofStatus(sortStatus);
    }
    StatusOr<TableQuery> whereOr = TableQuery.where(schema, resolvedOr.getValue(), null);
    if (whereOr.isNotOk()) {
      return StatusOr.ofStatus(whereOr.getStatus());
    }
    TableQuery where = whereOr.getValue();
    String sql = where.selectSql(sortField, direction, limit > 0);
    List<Object> params = limit > 0 ? where.pageParams(limit, 0) : where.params();
    try (Connection conn = dataSource.getConnection()) {
      return readRows(conn, sql, params);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.statusFromSqlException(e, "query " + entityName));
    }
  }

  /** The first row matching {@code filters}, if any. */
  protected StatusOr<Optional<R>> findFirstWhere(List<FilterOption> filters) {
    return findWhere(filters, defaults.defaultSortBy(), SortOrder.DESCENDING, 1)
        .map(rows -> rows.isEmpty() ? Optional.<R>empty() : Optional.of(rows.get(0)));
  }

  /**
   * Runs {@code SELECT EXISTS(SELECT 1 FROM table WHERE <condition>)}. The condition refers to
   * unqualified columns of the table.
   */
  protected StatusOr<Boolean> existsWhere(String condition, List<Object> params) {
    String sql = "SELECT EXISTS(SELECT 1 FROM " + schema.table() + " WHERE " + condition + ")";
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      DbUtil.bindParameters(stmt, params);
      try (ResultSet rs = stmt.executeQuery()) {
        return StatusOr.ofValue(rs.next() && rs.getBoolean(1));
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.statusFromSqlException(e, "check " + entityName));
    }
  }

  private StatusOr<PreparedQuery> prepare(ListOptions options) {
    StatusOr<ListOptions> normalizedOr = options.normalize(defaults);
    if (normalizedOr.isNotOk()) {
      return StatusOr.ofStatus(normalizedOr.getStatus());
    }
    ListOptions normalized = normalizedOr.getValue();
    Status sortStatus = schema.fields().checkSortField(normalized.sortBy());
    if (sortStatus.isError()) {
      return StatusOr.ofStatus(sortStatus);
    }
    StatusOr<List<FilterOption>> resolvedOr = schema.fields().resolveAll(normalized.filters());
    if (resolvedOr.isNotOk()) {
      return StatusOr.ofStatus(resolvedOr.getStatus());
    }
    StatusOr<TableQuery> whereOr =
        TableQuery.where(schema, resolvedOr.getValue(), normalized.search());
    if (whereOr.isNotOk()) {
      return StatusOr.ofStatus(whereOr.getStatus());
    }
    return StatusOr.ofValue(new PreparedQuery(normalized, whereOr.getValue()));
  }

  private StatusOr<List<R>> readPage(Connection conn, PreparedQuery query) throws SQLException {
    ListOptions options = query.options();
    String sql = query.where().selectSql(options.sortBy(), options.sortDirection(), true);
    return readRows(conn, sql, query.where().pageParams(options.limit(), options.offset()));
  }

  private long countRows(Connection conn, TableQuery where) throws SQLException {
    try (PreparedStatement stmt = conn.prepareStatement(where.countSql())) {
      DbUtil.bindParameters(stmt, where.params());
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    }
  }

  private StatusOr<R> loadById(Connection conn, UUID id) throws SQLException {
    String sql = schema.selectSql() + " WHERE " + schema.idColumn() + " = ?";
    StatusOr<List<R>> rowsOr = readRows(conn, sql, List.of(id));
    if (rowsOr.isNotOk()) {
      return StatusOr.ofStatus(rowsOr.getStatus());
    }
    if (rowsOr.getValue().isEmpty()) {
      return StatusOr.ofStatus(Status.notFound(entityName + " not found: " + id));
    }
    return StatusOr.ofValue(rowsOr.getValue().get(0));
  }

  private StatusOr<List<R>> readRows(Connection conn, String sql, List<Object> params)
      throws SQLException {
    List<R> rows = new ArrayList<>();
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      DbUtil.bindParameters(stmt, params);
      try (ResultSet rs = stmt.executeQuery()) {
        while (rs.next()) {
          StatusOr<R> rowOr = extract(rs);
          if (rowOr.isNotOk()) {
            return StatusOr.ofStatus(rowOr.getStatus());
          }
          rows.add(rowOr.getValue());
        }
      }
    }
    return StatusOr.ofValue(rows);
  }

  private record PreparedQuery(ListOptions options, TableQuery where) {}
}
