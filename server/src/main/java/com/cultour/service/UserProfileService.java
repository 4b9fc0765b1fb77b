package com.cultour.service;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.model.BadgeDto;
import com.cultour.model.UserProfileDto;
import com.cultour.model.UserProfileWrite;
import com.cultour.query.FilterOption;
import com.cultour.query.ListOptions;
import com.cultour.query.Page;
import com.cultour.query.QueryDefaults;
import com.cultour.query.SearchResult;
import com.cultour.repository.UserProfileRepository;
import com.cultour.repository.UserRepository;
import com.cultour.storage.BlobStore;
import com.cultour.storage.BlobUpload;
import com.cultour.validation.ValidationResult;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.UUID;
import org.tinylog.Logger;

/**
 * User profiles, their images, and the badges that profile milestones earn.
 *
 * <p>Badge grants run after the profile write has committed and are not rolled back with it. A
 * badge the user already holds is logged and ignored; any other grant failure is returned even
 * though the profile change itself was stored.
 */
public class UserProfileService {

  public static final long DEFAULT_MAX_UPLOAD_BYTES = 10L * 1024 * 1024;

  static final ImmutableSet<String> IMAGE_TYPES =
      ImmutableSet.of("image/jpeg", "image/png", "image/webp");

  static final String AVATAR_PREFIX = "images/avatars/";
  static final String IDENTITY_PREFIX = "images/identity/";

  private final Config config;

  /**
   * @param profiles profile storage
   * @param users the user directory, for the owner existence check
   * @param awarder grants milestone badges
   * @param blobs image storage
   * @param queryDefaults paging and sorting defaults for list calls
   * @param maxUploadBytes largest accepted image
   */
  public record Config(
      UserProfileRepository profiles,
      UserRepository users,
      BadgeAwarder awarder,
      BlobStore blobs,
      QueryDefaults queryDefaults,
      long maxUploadBytes) {}

  public UserProfileService(Config config) {
    this.config = config;
  }

  /**
   * Creates the profile of an existing user and grants the explorer badge.
   *
   * <p>Fails with INVALID_ARGUMENT on a bad payload, NOT_FOUND when the user or the explorer
   * badge does not exist, and ALREADY_EXISTS when the user has a profile already.
   */
  public StatusOr<UserProfileDto> createProfile(UserProfileWrite request) {
    ValidationResult validation = UserProfileWrite.CREATE_SCHEMA.validate(request);
    if (!validation.isValid()) {
      return StatusOr.ofStatus(validation.toStatus());
    }
    UUID userId = request.userId();

    StatusOr<Boolean> userExistsOr = config.users().exists(userId);
    if (userExistsOr.isNotOk()) {
      return StatusOr.ofStatus(userExistsOr.getStatus());
    }
    if (!userExistsOr.getValue()) {
      return StatusOr.ofStatus(Status.notFound("user " + userId + " does not exist"));
    }

    StatusOr<Boolean> profileExistsOr = config.profiles().existsByUserId(userId);
    if (profileExistsOr.isNotOk()) {
      return StatusOr.ofStatus(profileExistsOr.getStatus());
    }
    if (profileExistsOr.getValue()) {
      return StatusOr.ofStatus(
          Status.alreadyExists("profile for user " + userId + " already exists"));
    }

    StatusOr<BadgeDto> badgeOr = config.awarder().badgeFor(ProfileEvent.PROFILE_CREATED);
    if (badgeOr.isNotOk()) {
      return StatusOr.ofStatus(badgeOr.getStatus());
    }

    StatusOr<UserProfileDto> createdOr = config.profiles().create(request);
    if (createdOr.isNotOk()) {
      return createdOr;
    }
    Logger.info("Created profile {} for user {}", createdOr.getValue().id(), userId);

    Status grant = config.awarder().awardAfter(ProfileEvent.PROFILE_CREATED, userId);
    if (grant.isError()) {
      return StatusOr.ofStatus(grant);
    }
    return createdOr;
  }

  public StatusOr<UserProfileDto> getProfile(UUID id) {
    return config.profiles().findById(id);
  }

  public StatusOr<UserProfileDto> getProfileByUserId(UUID userId) {
    return config
        .profiles()
        .findByUserId(userId)
        .flatMap(
            profile -> StatusOr.fromOptional(profile, "profile for user " + userId + " not found"));
  }

  /** Applies the set text fields of {@code request}; the owning user never changes. */
  public StatusOr<UserProfileDto> updateProfile(UUID id, UserProfileWrite request) {
    ValidationResult validation = UserProfileWrite.UPDATE_SCHEMA.validate(request);
    if (!validation.isValid()) {
      return StatusOr.ofStatus(validation.toStatus());
    }
    StatusOr<UserProfileDto> currentOr = config.profiles().findById(id);
    if (currentOr.isNotOk()) {
      return currentOr;
    }
    UserProfileDto current = currentOr.getValue();
    UserProfileWrite merged =
        new UserProfileWrite(
            current.userId(),
            Merge.text(request.fullname(), current.fullname()),
            Merge.text(request.bio(), current.bio()),
            Merge.text(request.avatarUrl(), current.avatarUrl()),
            Merge.text(request.identityImageUrl(), current.identityImageUrl()));
    return config.profiles().update(id, merged);
  }

  /** Stores a new avatar image and records its URL on the profile. */
  public StatusOr<UserProfileDto> updateAvatar(UUID profileId, BlobUpload image) {
    Status check = checkImage(image);
    if (check.isError()) {
      return StatusOr.ofStatus(check.withContext("avatar"));
    }
    StatusOr<UserProfileDto> currentOr = config.profiles().findById(profileId);
    if (currentOr.isNotOk()) {
      return currentOr;
    }
    UserProfileDto current = currentOr.getValue();

    StatusOr<String> urlOr =
        config.blobs().put(AVATAR_PREFIX + current.userId() + image.extension(), image);
    if (urlOr.isNotOk()) {
      return StatusOr.ofStatus(urlOr.getStatus());
    }
    return config.profiles().update(profileId, withImages(current, urlOr.getValue(), null));
  }

  /**
   * Stores an identity document, records its URL on the profile, and grants the verified-local
   * badge.
   */
  public StatusOr<UserProfileDto> verifyIdentity(UUID profileId, BlobUpload image) {
    Status check = checkImage(image);
    if (check.isError()) {
      return StatusOr.ofStatus(check.withContext("identity image"));
    }
    StatusOr<UserProfileDto> currentOr = config.profiles().findById(profileId);
    if (currentOr.isNotOk()) {
      return currentOr;
    }
    UserProfileDto current = currentOr.getValue();

    StatusOr<String> urlOr =
        config.blobs().put(IDENTITY_PREFIX + current.userId() + image.extension(), image);
    if (urlOr.isNotOk()) {
      return StatusOr.ofStatus(urlOr.getStatus());
    }
    StatusOr<UserProfileDto> updatedOr =
        config.profiles().update(profileId, withImages(current, null, urlOr.getValue()));
    if (updatedOr.isNotOk()) {
      return updatedOr;
    }
    Logger.info("Identity verified for user {}", current.userId());

    Status grant = config.awarder().awardAfter(ProfileEvent.IDENTITY_VERIFIED, current.userId());
    if (grant.isError()) {
      return StatusOr.ofStatus(grant);
    }
    return updatedOr;
  }

  public Status deleteProfile(UUID id) {
    Status status = config.profiles().delete(id);
    if (status.isOk()) {
      Logger.info("Deleted profile {}", id);
    }
    return status;
  }

  public StatusOr<Page<UserProfileDto>> listProfiles(ListOptions options) {
    StatusOr<ListOptions> normalizedOr = options.normalize(config.queryDefaults());
    if (normalizedOr.isNotOk()) {
      return StatusOr.ofStatus(normalizedOr.getStatus());
    }
    ListOptions normalized = normalizedOr.getValue();
    StatusOr<SearchResult<UserProfileDto>> resultOr = config.profiles().search(normalized);
    return resultOr.map(result -> Page.of(result, normalized));
  }

  /** Like {@link #listProfiles} but requires search text, matched against name and bio. */
  public StatusOr<Page<UserProfileDto>> searchProfiles(ListOptions options) {
    if (options.search() == null || options.search().isBlank()) {
      return StatusOr.ofStatus(Status.invalidArgument("search text is required"));
    }
    return listProfiles(options);
  }

  public StatusOr<Long> countProfiles(List<FilterOption> filters) {
    return config.profiles().count(filters);
  }

  private Status checkImage(BlobUpload image) {
    if (image == null || image.size() == 0) {
      return Status.invalidArgument("an image file is required");
    }
    if (image.size() > config.maxUploadBytes()) {
      return Status.invalidArgument(
          "file is " + image.size() + " bytes, the limit is " + config.maxUploadBytes());
    }
    if (image.contentType() == null || !IMAGE_TYPES.contains(image.contentType())) {
      return Status.invalidArgument(
          "content type " + image.contentType() + " is not one of " + IMAGE_TYPES);
    }
    return Status.ok();
  }

  private static UserProfileWrite withImages(
      UserProfileDto current, String avatarUrl, String identityImageUrl) {
    return new UserProfileWrite(
        current.userId(),
        current.fullname(),
        current.bio(),
        Merge.text(avatarUrl, current.avatarUrl()),
        Merge.text(identityImageUrl, current.identityImageUrl()));
  }
}
