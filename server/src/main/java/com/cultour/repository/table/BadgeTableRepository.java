package com.cultour.repository.table;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.db.util.DbUtil;
import com.cultour.model.BadgeDto;
import com.cultour.model.BadgeWrite;
import com.cultour.query.FilterOperator;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterValue;
import com.cultour.query.QueryDefaults;
import com.cultour.query.SortOrder;
import com.cultour.repository.BadgeRepository;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;

/** Badge definitions in the {@code badges} table. Names are unique. */
public class BadgeTableRepository extends TableRepository<BadgeWrite, BadgeDto>
    implements BadgeRepository {

  static final TableSchema SCHEMA =
      TableSchema.builder()
          .table("badges")
          .select(
              """
              SELECT b.id, b.name, b.description, b.icon_url, b.created_at, b.updated_at
                FROM badges b
              """)
          .idColumn("b.id")
          .column("id", "b.id", FilterValue.Type.UUID)
          .column("name", "b.name", FilterValue.Type.STRING)
          .column("description", "b.description", FilterValue.Type.STRING)
          .column("icon_url", "b.icon_url", FilterValue.Type.STRING)
          .column("created_at", "b.created_at", FilterValue.Type.TIMESTAMP)
          .column("updated_at", "b.updated_at", FilterValue.Type.TIMESTAMP)
          .searchColumn("b.name")
          .searchColumn("b.description")
          .build();

  public BadgeTableRepository(DataSource dataSource, QueryDefaults defaults) {
    super(dataSource, defaults, SCHEMA, "badge");
  }

  @Override
  public StatusOr<Optional<BadgeDto>> findByName(String name) {
    return findFirstWhere(
        List.of(new FilterOption("name", FilterOperator.EQUAL, FilterValue.ofString(name))));
  }

  @Override
  public StatusOr<List<BadgeDto>> findNewest(int limit) {
    if (limit <= 0) {
      return StatusOr.ofStatus(Status.invalidArgument("limit must be positive"));
    }
    return findWhere(List.of(), "created_at", SortOrder.DESCENDING, limit);
  }

  @Override
  protected StatusOr<BadgeDto> extract(ResultSet rs) {
    try {
      StatusOr<UUID> idOr = DbUtil.getUuid(rs, "id");
      if (idOr.isNotOk()) {
        return StatusOr.ofStatus(idOr.getStatus());
      }
      StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
      if (createdAtOr.isNotOk()) {
        return StatusOr.ofStatus(createdAtOr.getStatus());
      }
      StatusOr<Optional<Instant>> updatedAtOr = DbUtil.getOptionalInstant(rs, "updated_at");
      if (updatedAtOr.isNotOk()) {
        return StatusOr.ofStatus(updatedAtOr.getStatus());
      }
      return StatusOr.ofValue(
          new BadgeDto(
              idOr.getValue(),
              rs.getString("name"),
              rs.getString("description"),
              rs.getString("icon_url"),
              createdAtOr.getValue(),
              updatedAtOr.getValue().orElse(createdAtOr.getValue())));
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  @Override
  protected void insertRow(Connection conn, UUID id, BadgeWrite value, Instant now)
      throws SQLException {
    String sql =
        """
        INSERT INTO badges (id, name, description, icon_url, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?)
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      stmt.setString(2, value.name());
      stmt.setString(3, value.description());
      stmt.setString(4, value.iconUrl());
      stmt.setTimestamp(5, DbUtil.toSqlTimestamp(now));
      stmt.setTimestamp(6, DbUtil.toSqlTimestamp(now));
      stmt.executeUpdate();
    }
  }

  @Override
  protected int updateRow(Connection conn, UUID id, BadgeWrite value, Instant now)
      throws SQLException {
    String sql =
        """
        UPDATE badges
           SET name = ?, description = ?, icon_url = ?, updated_at = ?
         WHERE id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, value.name());
      stmt.setString(2, value.description());
      stmt.setString(3, value.iconUrl());
      stmt.setTimestamp(4, DbUtil.toSqlTimestamp(now));
      stmt.setObject(5, id);
      return stmt.executeUpdate();
    }
  }
}
