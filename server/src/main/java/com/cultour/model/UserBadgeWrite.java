package com.cultour.model;

import com.cultour.validation.Rules;
import com.cultour.validation.Schema;
import java.util.UUID;

/**
 * A request to record that a user holds a badge.
 *
 * @param userId the user receiving the badge
 * @param badgeId the badge granted
 */
public record UserBadgeWrite(UUID userId, UUID badgeId) {

  public static final Schema<UserBadgeWrite> SCHEMA =
      Schema.<UserBadgeWrite>builder()
          .field("userId", UserBadgeWrite::userId, Rules.required(), Rules.identifier())
          .field("badgeId", UserBadgeWrite::badgeId, Rules.required(), Rules.identifier())
          .build();
}
