package com.cultour.service;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.model.UserBadgeDto;
import com.cultour.model.UserBadgeWrite;
import com.cultour.query.ListOptions;
import com.cultour.query.Page;
import com.cultour.query.QueryDefaults;
import com.cultour.query.SearchResult;
import com.cultour.repository.BadgeRepository;
import com.cultour.repository.UserBadgeRepository;
import com.cultour.repository.UserRepository;
import com.cultour.validation.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.tinylog.Logger;

/** Badges held by users. */
public class UserBadgeService {

  private final Config config;

  public record Config(
      UserBadgeRepository userBadges,
      UserRepository users,
      BadgeRepository badges,
      QueryDefaults queryDefaults) {}

  public UserBadgeService(Config config) {
    this.config = config;
  }

  /**
   * Grants a badge to a user.
   *
   * <p>Fails with NOT_FOUND when the user or the badge does not exist and ALREADY_EXISTS when the
   * user already holds the badge.
   */
  public StatusOr<UserBadgeDto> grantBadge(UUID userId, UUID badgeId) {
    UserBadgeWrite grant = new UserBadgeWrite(userId, badgeId);
    ValidationResult validation = UserBadgeWrite.SCHEMA.validate(grant);
    if (!validation.isValid()) {
      return StatusOr.ofStatus(validation.toStatus());
    }

    StatusOr<Boolean> userOr = config.users().exists(userId);
    if (userOr.isNotOk()) {
      return StatusOr.ofStatus(userOr.getStatus());
    }
    if (!userOr.getValue()) {
      return StatusOr.ofStatus(Status.notFound("user " + userId + " does not exist"));
    }

    StatusOr<Boolean> badgeOr = config.badges().exists(badgeId);
    if (badgeOr.isNotOk()) {
      return StatusOr.ofStatus(badgeOr.getStatus());
    }
    if (!badgeOr.getValue()) {
      return StatusOr.ofStatus(Status.notFound("badge " + badgeId + " does not exist"));
    }

    StatusOr<Boolean> heldOr = config.userBadges().existsGrant(userId, badgeId);
    if (heldOr.isNotOk()) {
      return StatusOr.ofStatus(heldOr.getStatus());
    }
    if (heldOr.getValue()) {
      return StatusOr.ofStatus(
          Status.alreadyExists("user " + userId + " already holds badge " + badgeId));
    }

    StatusOr<UserBadgeDto> createdOr = config.userBadges().create(grant);
    if (createdOr.isOk()) {
      Logger.info("Granted badge {} to user {}", badgeId, userId);
    }
    return createdOr;
  }

  /**
   * Grants each pair in order and stops at the first failure. Earlier grants are kept; the
   * returned status names how many were applied.
   */
  public StatusOr<List<UserBadgeDto>> bulkGrant(List<UserBadgeWrite> grants) {
    ValidationResult validation = UserBadgeWrite.SCHEMA.validateAll(grants);
    if (!validation.isValid()) {
      return StatusOr.ofStatus(validation.toStatus());
    }
    List<UserBadgeDto> granted = new ArrayList<>(grants.size());
    for (int i = 0; i < grants.size(); i++) {
      UserBadgeWrite grant = grants.get(i);
      StatusOr<UserBadgeDto> grantOr = grantBadge(grant.userId(), grant.badgeId());
      if (grantOr.isNotOk()) {
        return StatusOr.ofStatus(
            grantOr
                .getStatus()
                .withContext("bulk grant stopped at element " + i + " (" + i + " applied)"));
      }
      granted.add(grantOr.getValue());
    }
    return StatusOr.ofValue(granted);
  }

  public StatusOr<UserBadgeDto> getUserBadge(UUID id) {
    return config.userBadges().findById(id);
  }

  public StatusOr<List<UserBadgeDto>> listUserBadges(UUID userId) {
    return config.userBadges().findByUser(userId);
  }

  public StatusOr<List<UserBadgeDto>> listBadgeHolders(UUID badgeId) {
    return config.userBadges().findByBadge(badgeId);
  }

  public StatusOr<Long> countUserBadges(UUID userId) {
    return config.userBadges().countByUser(userId);
  }

  public Status revokeBadge(UUID id) {
    Status status = config.userBadges().delete(id);
    if (status.isOk()) {
      Logger.info("Revoked user badge {}", id);
    }
    return status;
  }

  /** Pages through grants; free text matches the badge name. */
  public StatusOr<Page<UserBadgeDto>> searchUserBadges(ListOptions options) {
    StatusOr<ListOptions> normalizedOr = options.normalize(config.queryDefaults());
    if (normalizedOr.isNotOk()) {
      return StatusOr.ofStatus(normalizedOr.getStatus());
    }
    ListOptions normalized = normalizedOr.getValue();
    StatusOr<SearchResult<UserBadgeDto>> resultOr = config.userBadges().search(normalized);
    return resultOr.map(result -> Page.of(result, normalized));
  }
}
