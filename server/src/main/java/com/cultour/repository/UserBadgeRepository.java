package com.cultour.repository;

import com.cultour.common.status.StatusOr;
import com.cultour.model.UserBadgeDto;
import com.cultour.model.UserBadgeWrite;
import java.util.List;
import java.util.UUID;

/** Badge grants. At most one per (user, badge) pair. */
public interface UserBadgeRepository extends Repository<UserBadgeWrite, UserBadgeDto> {

  StatusOr<List<UserBadgeDto>> findByUser(UUID userId);

  StatusOr<List<UserBadgeDto>> findByBadge(UUID badgeId);

  /** Whether {@code userId} already holds {@code badgeId}. */
  StatusOr<Boolean> existsGrant(UUID userId, UUID badgeId);

  StatusOr<Long> countByUser(UUID userId);
}
