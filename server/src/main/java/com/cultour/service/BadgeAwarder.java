package com.cultour.service;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import com.cultour.model.BadgeDto;
import com.cultour.model.UserBadgeDto;
import com.cultour.model.UserBadgeWrite;
import com.cultour.repository.BadgeRepository;
import com.cultour.repository.UserBadgeRepository;
import java.util.Optional;
import java.util.UUID;
import org.tinylog.Logger;

/**
 * Grants badges by name, either directly or for a {@link ProfileEvent} through the
 * {@link BadgeRuleTable}. A user holds each badge at most once: a repeated grant is answered with
 * ALREADY_EXISTS, whether the earlier grant is seen by the existence check or only by the
 * {@code users_badge} unique constraint.
 */
public class BadgeAwarder {

  private final Config config;

  public record Config(
      BadgeRuleTable rules, BadgeRepository badges, UserBadgeRepository userBadges) {}

  public BadgeAwarder(Config config) {
    this.config = config;
  }

  public BadgeRuleTable rules() {
    return config.rules();
  }

  /** The badge an event grants. NOT_FOUND when the event has no rule or the badge is missing. */
  public StatusOr<BadgeDto> badgeFor(ProfileEvent event) {
    Optional<String> name = config.rules().badgeFor(event);
    if (name.isEmpty()) {
      return StatusOr.ofStatus(Status.notFound("no badge is configured for " + event));
    }
    return findBadge(name.get());
  }

  /** Grants {@code badgeName} to the user unless they already hold it. */
  public StatusOr<UserBadgeDto> tryGrant(UUID userId, String badgeName) {
    StatusOr<BadgeDto> badgeOr = findBadge(badgeName);
    if (badgeOr.isNotOk()) {
      return StatusOr.ofStatus(badgeOr.getStatus());
    }
    BadgeDto badge = badgeOr.getValue();

    StatusOr<Boolean> heldOr = config.userBadges().existsGrant(userId, badge.id());
    if (heldOr.isNotOk()) {
      return StatusOr.ofStatus(heldOr.getStatus());
    }
    if (heldOr.getValue()) {
      return StatusOr.ofStatus(
          Status.alreadyExists("user " + userId + " already holds badge " + badge.name()));
    }

    StatusOr<UserBadgeDto> grantOr =
        config.userBadges().create(new UserBadgeWrite(userId, badge.id()));
    if (grantOr.isOk()) {
      Logger.info("Granted badge {} to user {}", badge.name(), userId);
    }
    return grantOr;
  }

  /**
   * Grants whatever badge the rule table assigns to {@code event}.
   *
   * @return the new grant, ALREADY_EXISTS when the user already holds the badge, or the failure
   */
  public StatusOr<UserBadgeDto> onEvent(ProfileEvent event, UUID userId) {
    Optional<String> name = config.rules().badgeFor(event);
    if (name.isEmpty()) {
      return StatusOr.ofStatus(Status.notFound("no badge is configured for " + event));
    }
    return tryGrant(userId, name.get());
  }

  /**
   * Runs {@link #onEvent} after a workflow's own write has committed. Any failure is returned,
   * including ALREADY_EXISTS when the user already holds the badge; the workflow's write stays.
   */
  Status awardAfter(ProfileEvent event, UUID userId) {
    StatusOr<UserBadgeDto> grantOr = onEvent(event, userId);
    if (grantOr.isOk()) {
      return Status.ok();
    }
    if (grantOr.getStatus().getCode() == StatusCode.ALREADY_EXISTS) {
      Logger.info("Badge for {} already granted to user {}", event, userId);
    } else {
      Logger.warn(
          "Badge grant for {} failed for user {}: {}", event, userId, grantOr.getStatus());
    }
    return grantOr.getStatus().withContext("badge grant for " + event);
  }

  private StatusOr<BadgeDto> findBadge(String name) {
    StatusOr<Optional<BadgeDto>> badgeOr = config.badges().findByName(name);
    if (badgeOr.isNotOk()) {
      return StatusOr.ofStatus(badgeOr.getStatus());
    }
    if (badgeOr.getValue().isEmpty()) {
      return StatusOr.ofStatus(Status.notFound("badge " + name + " does not exist"));
    }
    return StatusOr.ofValue(badgeOr.getValue().get());
  }
}
