package com.cultour.repository;

import com.cultour.common.status.StatusOr;
import com.cultour.model.UserProfileDto;
import com.cultour.model.UserProfileWrite;
import java.util.Optional;
import java.util.UUID;

/** User profiles. A user has at most one. */
public interface UserProfileRepository extends Repository<UserProfileWrite, UserProfileDto> {

  StatusOr<Optional<UserProfileDto>> findByUserId(UUID userId);

  StatusOr<Boolean> existsByUserId(UUID userId);
}
