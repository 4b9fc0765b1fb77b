package com.cultour.repository;

import com.cultour.common.status.StatusOr;
import com.cultour.model.BadgeDto;
import com.cultour.model.BadgeWrite;
import java.util.List;
import java.util.Optional;

/** Achievement badges. Names are unique. */
public interface BadgeRepository extends Repository<BadgeWrite, BadgeDto> {

  StatusOr<Optional<BadgeDto>> findByName(String name);

  /** The most recently created badges, newest first. */
  StatusOr<List<BadgeDto>> findNewest(int limit);
}
