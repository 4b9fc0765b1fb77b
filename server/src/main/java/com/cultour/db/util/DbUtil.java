package com.cultour.db.util;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;

/** Helpers shared by the JDBC repositories. */
public final class DbUtil {

  /** PostgreSQL SQLState for a unique constraint violation. */
  public static final String UNIQUE_VIOLATION = "23505";

  /** PostgreSQL SQLState for a foreign key violation. */
  public static final String FOREIGN_KEY_VIOLATION = "23503";

  /** PostgreSQL SQLState for a NOT NULL violation. */
  public static final String NOT_NULL_VIOLATION = "23502";

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return Timestamp.from(instant);
  }

  /** Reads a non-null UUID column. */
  @Nonnull
  public static StatusOr<UUID> getUuid(ResultSet rs, String columnName) {
    try {
      UUID uuid = rs.getObject(columnName, UUID.class);
      if (rs.wasNull() || uuid == null) {
        return StatusOr.ofStatus(Status.internal("Column " + columnName + " is null", null));
      }
      return StatusOr.ofValue(uuid);
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get UUID: " + e.getMessage(), e));
    }
  }

  /** Reads a nullable UUID column, for example the id of an outer-joined row. */
  @Nonnull
  public static StatusOr<Optional<UUID>> getOptionalUuid(ResultSet rs, String columnName) {
    try {
      UUID uuid = rs.getObject(columnName, UUID.class);
      if (rs.wasNull() || uuid == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(uuid));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get UUID: " + e.getMessage(), e));
    }
  }

  /** Reads a non-null timestamp column. */
  @Nonnull
  public static StatusOr<Instant> getInstant(ResultSet rs, String columnName) {
    try {
      Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofStatus(Status.internal("Column " + columnName + " is null", null));
      }
      return StatusOr.ofValue(timestamp.toInstant());
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /** Reads a nullable timestamp column. */
  @Nonnull
  public static StatusOr<Optional<Instant>> getOptionalInstant(ResultSet rs, String columnName) {
    try {
      Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(timestamp.toInstant()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /**
   * Binds positional parameters starting at index 1. Instants are bound as SQL timestamps, every
   * other value through {@link PreparedStatement#setObject(int, Object)}.
   */
  public static void bindParameters(PreparedStatement stmt, List<Object> params)
      throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      Object param = params.get(i);
      if (param instanceof Instant) {
        stmt.setTimestamp(i + 1, toSqlTimestamp((Instant) param));
      } else {
        stmt.setObject(i + 1, param);
      }
    }
  }

  /**
   * Maps a JDBC failure onto the error kinds.
   *
   * <ul>
   *   <li>unique violation: ALREADY_EXISTS
   *   <li>foreign key violation: NOT_FOUND (the referenced row is missing)
   *   <li>not-null violation and data exceptions (class 22): INVALID_ARGUMENT
   *   <li>anything else: UNAVAILABLE
   * </ul>
   *
   * @param e the driver exception
   * @param context what was being attempted, e.g. {@code "insert badge"}
   */
  @Nonnull
  public static Status statusFromSqlException(SQLException e, String context) {
    String sqlState = e.getSQLState() == null ? "" : e.getSQLState();
    StatusCode code;
    if (UNIQUE_VIOLATION.equals(sqlState)) {
      code = StatusCode.ALREADY_EXISTS;
    } else if (FOREIGN_KEY_VIOLATION.equals(sqlState)) {
      code = StatusCode.NOT_FOUND;
    } else if (NOT_NULL_VIOLATION.equals(sqlState) || sqlState.startsWith("22")) {
      code = StatusCode.INVALID_ARGUMENT;
    } else {
      code = StatusCode.UNAVAILABLE;
    }
    return Status.of(code, context + " failed: " + e.getMessage(), e);
  }
}
