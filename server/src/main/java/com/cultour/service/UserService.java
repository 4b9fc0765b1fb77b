package com.cultour.service;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.model.UserDto;
import com.cultour.model.UserWrite;
import com.cultour.query.FilterOption;
import com.cultour.query.ListOptions;
import com.cultour.query.Page;
import com.cultour.query.QueryDefaults;
import com.cultour.query.SearchResult;
import com.cultour.repository.UserRepository;
import com.cultour.validation.ValidationResult;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.tinylog.Logger;

/** User accounts, stored in the external directory. */
public class UserService {

  private final Config config;

  /**
   * @param users the user directory
   * @param queryDefaults paging and sorting defaults for list calls
   */
  public record Config(UserRepository users, QueryDefaults queryDefaults) {}

  public UserService(Config config) {
    this.config = config;
  }

  /**
   * Registers a user. The role defaults to {@code user}.
   *
   * <p>Fails with INVALID_ARGUMENT on a bad payload and ALREADY_EXISTS when the e-mail address
   * is taken.
   */
  public StatusOr<UserDto> createUser(UserWrite request) {
    if (request == null) {
      return StatusOr.ofStatus(Status.invalidArgument("user payload required"));
    }
    UserWrite user = request.withDefaultRole();
    ValidationResult validation = UserWrite.CREATE_SCHEMA.validate(user);
    if (!validation.isValid()) {
      return StatusOr.ofStatus(validation.toStatus());
    }

    StatusOr<Boolean> takenOr = config.users().existsByEmail(user.email());
    if (takenOr.isNotOk()) {
      return StatusOr.ofStatus(takenOr.getStatus());
    }
    if (takenOr.getValue()) {
      return StatusOr.ofStatus(Status.alreadyExists("email " + user.email() + " is taken"));
    }

    Logger.info("Creating user {}", user.email());
    return config.users().create(user);
  }

  public StatusOr<UserDto> getUser(UUID id) {
    return config.users().findById(id);
  }

  public StatusOr<UserDto> getUserByEmail(String email) {
    if (email == null || email.isBlank()) {
      return StatusOr.ofStatus(Status.invalidArgument("email is required"));
    }
    return config
        .users()
        .findByEmail(email)
        .flatMap(user -> StatusOr.fromOptional(user, "user with email " + email + " not found"));
  }

  /**
   * Applies the set fields of {@code request} to the stored user. A changed e-mail address must
   * not belong to another user.
   */
  public StatusOr<UserDto> updateUser(UUID id, UserWrite request) {
    if (request == null) {
      return StatusOr.ofStatus(Status.invalidArgument("user payload required"));
    }
    ValidationResult validation = UserWrite.UPDATE_SCHEMA.validate(request);
    if (!validation.isValid()) {
      return StatusOr.ofStatus(validation.toStatus());
    }

    StatusOr<UserDto> currentOr = config.users().findById(id);
    if (currentOr.isNotOk()) {
      return currentOr;
    }
    UserDto current = currentOr.getValue();

    String email = Merge.text(request.email(), current.email());
    if (!email.equalsIgnoreCase(current.email())) {
      StatusOr<Optional<UserDto>> ownerOr = config.users().findByEmail(email);
      if (ownerOr.isNotOk()) {
        return StatusOr.ofStatus(ownerOr.getStatus());
      }
      if (ownerOr.getValue().isPresent() && !ownerOr.getValue().get().id().equals(id)) {
        return StatusOr.ofStatus(Status.alreadyExists("email " + email + " is taken"));
      }
    }

    UserWrite merged =
        new UserWrite(
            email,
            request.password(),
            Merge.text(request.phone(), current.phone()),
            Merge.text(request.role(), current.role()));
    Logger.info("Updating user {}", id);
    return config.users().update(id, merged);
  }

  public Status deleteUser(UUID id) {
    Status status = config.users().delete(id);
    if (status.isOk()) {
      Logger.info("Deleted user {}", id);
    }
    return status;
  }

  public StatusOr<Page<UserDto>> listUsers(ListOptions options) {
    StatusOr<ListOptions> normalizedOr = options.normalize(config.queryDefaults());
    if (normalizedOr.isNotOk()) {
      return StatusOr.ofStatus(normalizedOr.getStatus());
    }
    ListOptions normalized = normalizedOr.getValue();
    StatusOr<SearchResult<UserDto>> resultOr = config.users().search(normalized);
    return resultOr.map(result -> Page.of(result, normalized));
  }

  public StatusOr<Long> countUsers(List<FilterOption> filters) {
    return config.users().count(filters);
  }
}
