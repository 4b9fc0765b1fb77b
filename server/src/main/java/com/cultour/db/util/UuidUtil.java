package com.cultour.db.util;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import java.util.UUID;
import javax.annotation.Nonnull;

/** Utility methods for working with UUIDs. */
public final class UuidUtil {

  /** The all-zero UUID, never a valid entity identifier. */
  public static final UUID NIL = new UUID(0L, 0L);

  private UuidUtil() {
    // Utility class, no instances
  }

  /**
   * Parses an identifier, rejecting malformed strings and the nil UUID.
   *
   * @param str the string representation of the UUID
   * @return StatusOr containing the UUID or an INVALID_ARGUMENT status
   */
  @Nonnull
  public static StatusOr<UUID> fromString(String str) {
    if (str == null || str.isEmpty()) {
      return StatusOr.ofStatus(Status.invalidArgument("UUID string cannot be null or empty"));
    }
    try {
      UUID uuid = UUID.fromString(str);
      if (NIL.equals(uuid)) {
        return StatusOr.ofStatus(Status.invalidArgument("UUID must not be the nil UUID"));
      }
      return StatusOr.ofValue(uuid);
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(Status.invalidArgument("Invalid UUID string: " + str));
    }
  }
}
