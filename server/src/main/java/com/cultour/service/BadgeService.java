package com.cultour.service;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.model.BadgeDto;
import com.cultour.model.BadgeWrite;
import com.cultour.query.FilterOption;
import com.cultour.query.ListOptions;
import com.cultour.query.Page;
import com.cultour.query.QueryDefaults;
import com.cultour.query.SearchResult;
import com.cultour.repository.BadgeRepository;
import com.cultour.validation.ValidationResult;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.tinylog.Logger;

/** Badge definitions. Badge names are unique. */
public class BadgeService {

  public static final int MAX_POPULAR_BADGES = 100;

  private final Config config;

  public record Config(BadgeRepository badges, QueryDefaults queryDefaults) {}

  public BadgeService(Config config) {
    this.config = config;
  }

  public StatusOr<BadgeDto> createBadge(BadgeWrite request) {
    ValidationResult validation = BadgeWrite.CREATE_SCHEMA.validate(request);
    if (!validation.isValid()) {
      return StatusOr.ofStatus(validation.toStatus());
    }
    Status nameFree = checkNameFree(request.name(), null);
    if (nameFree.isError()) {
      return StatusOr.ofStatus(nameFree);
    }
    StatusOr<BadgeDto> createdOr = config.badges().create(request);
    if (createdOr.isOk()) {
      Logger.info("Created badge {} ({})", createdOr.getValue().name(), createdOr.getValue().id());
    }
    return createdOr;
  }

  public StatusOr<BadgeDto> getBadge(UUID id) {
    return config.badges().findById(id);
  }

  public StatusOr<BadgeDto> getBadgeByName(String name) {
    if (name == null || name.isBlank()) {
      return StatusOr.ofStatus(Status.invalidArgument("badge name is required"));
    }
    return config
        .badges()
        .findByName(name)
        .flatMap(badge -> StatusOr.fromOptional(badge, "badge " + name + " not found"));
  }

  /** Applies the set fields of {@code request}. A new name must not belong to another badge. */
  public StatusOr<BadgeDto> updateBadge(UUID id, BadgeWrite request) {
    ValidationResult validation = BadgeWrite.UPDATE_SCHEMA.validate(request);
    if (!validation.isValid()) {
      return StatusOr.ofStatus(validation.toStatus());
    }
    StatusOr<BadgeDto> currentOr = config.badges().findById(id);
    if (currentOr.isNotOk()) {
      return currentOr;
    }
    BadgeDto current = currentOr.getValue();

    String name = Merge.text(request.name(), current.name());
    if (!name.equals(current.name())) {
      Status nameFree = checkNameFree(name, id);
      if (nameFree.isError()) {
        return StatusOr.ofStatus(nameFree);
      }
    }
    BadgeWrite merged =
        new BadgeWrite(
            name,
            Merge.text(request.description(), current.description()),
            Merge.text(request.iconUrl(), current.iconUrl()));
    return config.badges().update(id, merged);
  }

  public Status deleteBadge(UUID id) {
    Status status = config.badges().delete(id);
    if (status.isOk()) {
      Logger.info("Deleted badge {}", id);
    }
    return status;
  }

  public StatusOr<Page<BadgeDto>> listBadges(ListOptions options) {
    StatusOr<ListOptions> normalizedOr = options.normalize(config.queryDefaults());
    if (normalizedOr.isNotOk()) {
      return StatusOr.ofStatus(normalizedOr.getStatus());
    }
    ListOptions normalized = normalizedOr.getValue();
    StatusOr<SearchResult<BadgeDto>> resultOr = config.badges().search(normalized);
    return resultOr.map(result -> Page.of(result, normalized));
  }

  public StatusOr<Long> countBadges(List<FilterOption> filters) {
    return config.badges().count(filters);
  }

  /** The {@code limit} most recently created badges. */
  public StatusOr<List<BadgeDto>> popularBadges(int limit) {
    if (limit < 1 || limit > MAX_POPULAR_BADGES) {
      return StatusOr.ofStatus(
          Status.invalidArgument("limit must be between 1 and " + MAX_POPULAR_BADGES));
    }
    return config.badges().findNewest(limit);
  }

  private Status checkNameFree(String name, UUID allowedOwner) {
    StatusOr<Optional<BadgeDto>> existingOr = config.badges().findByName(name);
    if (existingOr.isNotOk()) {
      return existingOr.getStatus();
    }
    Optional<BadgeDto> existing = existingOr.getValue();
    if (existing.isPresent() && !existing.get().id().equals(allowedOwner)) {
      return Status.alreadyExists("badge " + name + " already exists");
    }
    return Status.ok();
  }
}
