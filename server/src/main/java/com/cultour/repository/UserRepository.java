package com.cultour.repository;

import com.cultour.common.status.StatusOr;
import com.cultour.model.UserDto;
import com.cultour.model.UserWrite;
import java.util.Optional;

/** Users, held by the identity directory. */
public interface UserRepository extends Repository<UserWrite, UserDto> {

  StatusOr<Optional<UserDto>> findByEmail(String email);

  StatusOr<Boolean> existsByEmail(String email);
}
