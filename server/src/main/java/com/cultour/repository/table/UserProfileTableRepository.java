package com.cultour.repository.table;

import com.cultour.common.status.StatusOr;
import com.cultour.db.util.DbUtil;
import com.cultour.model.UserProfileDto;
import com.cultour.model.UserProfileWrite;
import com.cultour.model.UserSummary;
import com.cultour.query.FilterOption;
import com.cultour.query.FilterOperator;
import com.cultour.query.FilterValue;
import com.cultour.query.QueryDefaults;
import com.cultour.repository.UserProfileRepository;
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
 * Profiles in {@code users_profile}, each joined with its owner from {@code users_view}.
 *
 * <p>The table's {@code UNIQUE (user_id)} constraint backs the one-profile-per-user rule, so
 * two concurrent inserts for the same user cannot both succeed; the loser gets ALREADY_EXISTS.
 */
public class UserProfileTableRepository
    extends TableRepository<UserProfileWrite, UserProfileDto>
    implements UserProfileRepository {

  static final TableSchema SCHEMA =
      TableSchema.builder()
          .table("users_profile")
          .select(
              """
              SELECT p.id, p.user_id, p.fullname, p.bio, p.avatar_url, p.identity_image_url,
                     p.created_at, p.updated_at,
                     u.id AS owner_id, u.email AS owner_email, u.role AS owner_role
                FROM users_profile p
                LEFT JOIN users_view u ON u.id = p.user_id
              """)
          .idColumn("p.id")
          .column("id", "p.id", FilterValue.Type.UUID)
          .column("user_id", "p.user_id", FilterValue.Type.UUID)
          .column("fullname", "p.fullname", FilterValue.Type.STRING)
          .column("bio", "p.bio", FilterValue.Type.STRING)
          .column("avatar_url", "p.avatar_url", FilterValue.Type.STRING)
          .column("identity_image_url", "p.identity_image_url", FilterValue.Type.STRING)
          .column("created_at", "p.created_at", FilterValue.Type.TIMESTAMP)
          .column("updated_at", "p.updated_at", FilterValue.Type.TIMESTAMP)
          .searchColumn("p.fullname")
          .searchColumn("p.bio")
          .build();

  public UserProfileTableRepository(DataSource dataSource, QueryDefaults defaults) {
    super(dataSource, defaults, SCHEMA, "profile");
  }

  @Override
  public StatusOr<Optional<UserProfileDto>> findByUserId(UUID userId) {
    return findFirstWhere(
        List.of(new FilterOption("user_id", FilterOperator.EQUAL, FilterValue.ofUuid(userId))));
  }

  @Override
  public StatusOr<Boolean> existsByUserId(UUID userId) {
    return existsWhere("user_id = ?", List.of(userId));
  }

  @Override
  protected StatusOr<UserProfileDto> extract(ResultSet rs) {
    try {
      StatusOr<UUID> idOr = DbUtil.getUuid(rs, "id");
      if (idOr.isNotOk()) {
        return StatusOr.ofStatus(idOr.getStatus());
      }
      StatusOr<UUID> userIdOr = DbUtil.getUuid(rs, "user_id");
      if (userIdOr.isNotOk()) {
        return StatusOr.ofStatus(userIdOr.getStatus());
      }
      StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
      if (createdAtOr.isNotOk()) {
        return StatusOr.ofStatus(createdAtOr.getStatus());
      }
      StatusOr<Optional<Instant>> updatedAtOr = DbUtil.getOptionalInstant(rs, "updated_at");
      if (updatedAtOr.isNotOk()) {
        return StatusOr.ofStatus(updatedAtOr.getStatus());
      }
      StatusOr<Optional<UUID>> ownerIdOr = DbUtil.getOptionalUuid(rs, "owner_id");
      if (ownerIdOr.isNotOk()) {
        return StatusOr.ofStatus(ownerIdOr.getStatus());
      }

      UserSummary owner = null;
      if (ownerIdOr.getValue().isPresent()) {
        owner =
            new UserSummary(
                ownerIdOr.getValue().get(),
                rs.getString("owner_email"),
                rs.getString("owner_role"));
      }

      return StatusOr.ofValue(
          new UserProfileDto(
              idOr.getValue(),
              userIdOr.getValue(),
              rs.getString("fullname"),
              rs.getString("bio"),
              rs.getString("avatar_url"),
              rs.getString("identity_image_url"),
              createdAtOr.getValue(),
              updatedAtOr.getValue().orElse(createdAtOr.getValue()),
              owner));
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  @Override
  protected void insertRow(Connection conn, UUID id, UserProfileWrite value, Instant now)
      throws SQLException {
    String sql =
        """
        INSERT INTO users_profile
               (id, user_id, fullname, bio, avatar_url, identity_image_url, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      stmt.setObject(2, value.userId());
      stmt.setString(3, value.fullname());
      stmt.setString(4, value.bio());
      stmt.setString(5, value.avatarUrl());
      stmt.setString(6, value.identityImageUrl());
      stmt.setTimestamp(7, DbUtil.toSqlTimestamp(now));
      stmt.setTimestamp(8, DbUtil.toSqlTimestamp(now));
      stmt.executeUpdate();
    }
  }

  @Override
  protected int updateRow(Connection conn, UUID id, UserProfileWrite value, Instant now)
      throws SQLException {
    String sql =
        """
        UPDATE users_profile
           SET fullname = ?, bio = ?, avatar_url = ?, identity_image_url = ?, updated_at = ?
         WHERE id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, value.fullname());
      stmt.setString(2, value.bio());
      stmt.setString(3, value.avatarUrl());
      stmt.setString(4, value.identityImageUrl());
      stmt.setTimestamp(5, DbUtil.toSqlTimestamp(now));
      stmt.setObject(6, id);
      return stmt.executeUpdate();
    }
  }
}
