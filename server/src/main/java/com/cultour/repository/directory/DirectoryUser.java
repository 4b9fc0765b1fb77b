package com.cultour.repository.directory;

import com.cultour.model.UserDto;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.gson.annotations.SerializedName;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * A user as the directory's admin API returns it. Timestamps stay in their wire form until
 * {@link #toDto()} converts them.
 */
public record DirectoryUser(
    String id,
    String email,
    String phone,
    String role,
    @SerializedName("last_sign_in_at") String lastSignInAt,
    @SerializedName("created_at") String createdAt,
    @SerializedName("updated_at") String updatedAt) {

  /**
   * Converts to the read model.
   *
   * @throws IllegalArgumentException if the id is missing or malformed, or a timestamp is
   *     malformed
   */
  public UserDto toDto() {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(id), "directory user has no id");
    return new UserDto(
        UUID.fromString(id),
        email,
        emptyToNull(phone),
        role,
        parseTime(lastSignInAt),
        parseTime(createdAt),
        parseTime(updatedAt));
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  private static Instant parseTime(String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("bad directory timestamp: " + value, e);
    }
  }
}
