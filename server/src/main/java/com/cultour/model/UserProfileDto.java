package com.cultour.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A stored user profile.
 *
 * @param id profile identifier
 * @param userId owning user
 * @param fullname display name
 * @param bio biography, possibly null
 * @param avatarUrl avatar URL, possibly null
 * @param identityImageUrl identity document URL, null until identity is verified
 * @param createdAt creation time
 * @param updatedAt last modification time
 * @param user the owning user, or null if the directory view has no matching row
 */
public record UserProfileDto(
    UUID id,
    UUID userId,
    String fullname,
    String bio,
    String avatarUrl,
    String identityImageUrl,
    Instant createdAt,
    Instant updatedAt,
    UserSummary user) {

  /** Whether an identity document has been recorded for this profile. */
  public boolean isIdentityVerified() {
    return identityImageUrl != null && !identityImageUrl.isEmpty();
  }
}
