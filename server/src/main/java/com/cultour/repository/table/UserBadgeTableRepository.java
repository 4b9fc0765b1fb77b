package com.cultour.repository.table;

import com.cultour.common.status.StatusOr;
import com.cultour.db.util.DbUtil;
import com.cultour.model.BadgeDto;
import com.cultour.model.UserBadgeDto;
import com.cultour.model.UserBadgeWrite;
import com.cultour.query.FilterOperator;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterValue;
import com.cultour.query.QueryDefaults;
import com.cultour.query.SortOrder;
import com.cultour.repository.UserBadgeRepository;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;

/**
 * Badge grants in {@code users_badge}, joined with the granted badge.
 *
 * <p>{@code UNIQUE (user_id, badge_id)} makes granting idempotent under concurrency: a second
 * insert of the same pair fails with ALREADY_EXISTS regardless of any earlier existence check.
 */
public class UserBadgeTableRepository extends TableRepository<UserBadgeWrite, UserBadgeDto>
    implements UserBadgeRepository {

  static final TableSchema SCHEMA =
      TableSchema.builder()
          .table("users_badge")
          .select(
              """
              SELECT ub.id, ub.user_id, ub.badge_id, ub.created_at,
                     b.id AS badge_ref_id, b.name AS badge_name,
                     b.description AS badge_description, b.icon_url AS badge_icon_url,
                     b.created_at AS badge_created_at, b.updated_at AS badge_updated_at
                FROM users_badge ub
                LEFT JOIN badges b ON b.id = ub.badge_id
              """)
          .idColumn("ub.id")
          .column("id", "ub.id", FilterValue.Type.UUID)
          .column("user_id", "ub.user_id", FilterValue.Type.UUID)
          .column("badge_id", "ub.badge_id", FilterValue.Type.UUID)
          .column("created_at", "ub.created_at", FilterValue.Type.TIMESTAMP)
          .column("badge_name", "b.name", FilterValue.Type.STRING)
          .searchColumn("b.name")
          .build();

  public UserBadgeTableRepository(DataSource dataSource, QueryDefaults defaults) {
    super(dataSource, defaults, SCHEMA, "user badge");
  }

  @Override
  public StatusOr<List<UserBadgeDto>> findByUser(UUID userId) {
    return findWhere(
        List.of(new FilterOption("user_id", FilterOperator.EQUAL, FilterValue.ofUuid(userId))),
        "created_at",
        SortOrder.ASCENDING,
        0);
  }

  @Override
  public StatusOr<List<UserBadgeDto>> findByBadge(UUID badgeId) {
    return findWhere(
        List.of(new FilterOption("badge_id", FilterOperator.EQUAL, FilterValue.ofUuid(badgeId))),
        "created_at",
        SortOrder.ASCENDING,
        0);
  }

  @Override
  public StatusOr<Boolean> existsGrant(UUID userId, UUID badgeId) {
    return existsWhere("user_id = ? AND badge_id = ?", List.of(userId, badgeId));
  }

  @Override
  public StatusOr<Long> countByUser(UUID userId) {
    return count(
        List.of(new FilterOption("user_id", FilterOperator.EQUAL, FilterValue.ofUuid(userId))));
  }

  @Override
  protected StatusOr<UserBadgeDto> extract(ResultSet rs) {
    try {
      StatusOr<UUID> idOr = DbUtil.getUuid(rs, "id");
      if (idOr.isNotOk()) {
        return StatusOr.ofStatus(idOr.getStatus());
      }
      StatusOr<UUID> userIdOr = DbUtil.getUuid(rs, "user_id");
      if (userIdOr.isNotOk()) {
        return StatusOr.ofStatus(userIdOr.getStatus());
      }
      StatusOr<UUID> badgeIdOr = DbUtil.getUuid(rs, "badge_id");
      if (badgeIdOr.isNotOk()) {
        return StatusOr.ofStatus(badgeIdOr.getStatus());
      }
      StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
      if (createdAtOr.isNotOk()) {
        return StatusOr.ofStatus(createdAtOr.getStatus());
      }
      StatusOr<Optional<UUID>> badgeRefOr = DbUtil.getOptionalUuid(rs, "badge_ref_id");
      if (badgeRefOr.isNotOk()) {
        return StatusOr.ofStatus(badgeRefOr.getStatus());
      }

      BadgeDto badge = null;
      if (badgeRefOr.getValue().isPresent()) {
        StatusOr<Optional<Instant>> badgeCreatedOr =
            DbUtil.getOptionalInstant(rs, "badge_created_at");
        if (badgeCreatedOr.isNotOk()) {
          return StatusOr.ofStatus(badgeCreatedOr.getStatus());
        }
        StatusOr<Optional<Instant>> badgeUpdatedOr =
            DbUtil.getOptionalInstant(rs, "badge_updated_at");
        if (badgeUpdatedOr.isNotOk()) {
          return StatusOr.ofStatus(badgeUpdatedOr.getStatus());
        }
        badge =
            new BadgeDto(
                badgeRefOr.getValue().get(),
                rs.getString("badge_name"),
                rs.getString("badge_description"),
                rs.getString("badge_icon_url"),
                badgeCreatedOr.getValue().orElse(null),
                badgeUpdatedOr.getValue().orElse(null));
      }

      return StatusOr.ofValue(
          new UserBadgeDto(
              idOr.getValue(),
              userIdOr.getValue(),
              badgeIdOr.getValue(),
              createdAtOr.getValue(),
              badge));
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  @Override
  protected void insertRow(Connection conn, UUID id, UserBadgeWrite value, Instant now)
      throws SQLException {
    String sql =
        """
        INSERT INTO users_badge (id, user_id, badge_id, created_at)
        VALUES (?, ?, ?, ?)
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      stmt.setObject(2, value.userId());
      stmt.setObject(3, value.badgeId());
      stmt.setTimestamp(4, DbUtil.toSqlTimestamp(now));
      stmt.executeUpdate();
    }
  }

  @Override
  protected int updateRow(Connection conn, UUID id, UserBadgeWrite value, Instant now)
      throws SQLException {
    String sql =
        """
        UPDATE users_badge
           SET user_id = ?, badge_id = ?
         WHERE id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, value.userId());
      stmt.setObject(2, value.badgeId());
      stmt.setObject(3, id);
      return stmt.executeUpdate();
    }
  }
}
