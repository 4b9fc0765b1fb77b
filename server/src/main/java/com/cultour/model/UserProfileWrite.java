package com.cultour.model;

import com.cultour.validation.Rules;
import com.cultour.validation.Schema;
import java.util.UUID;

/**
 * Creation or update payload for a user profile.
 *
 * @param userId owning user; required on create, ignored on update
 * @param fullname display name
 * @param bio free-text biography
 * @param avatarUrl public URL of the avatar image
 * @param identityImageUrl public URL of the verified identity document
 */
public record UserProfileWrite(
    UUID userId, String fullname, String bio, String avatarUrl, String identityImageUrl) {

  public static final Schema<UserProfileWrite> CREATE_SCHEMA =
      Schema.<UserProfileWrite>builder()
          .field("userId", UserProfileWrite::userId, Rules.required(), Rules.identifier())
          .field("fullname", UserProfileWrite::fullname, Rules.required(), Rules.max(100))
          .field("bio", UserProfileWrite::bio, Rules.max(500))
          .field("avatarUrl", UserProfileWrite::avatarUrl, Rules.max(2048))
          .field("identityImageUrl", UserProfileWrite::identityImageUrl, Rules.max(2048))
          .build();

  public static final Schema<UserProfileWrite> UPDATE_SCHEMA =
      Schema.<UserProfileWrite>builder()
          .field("fullname", UserProfileWrite::fullname, Rules.max(100))
          .field("bio", UserProfileWrite::bio, Rules.max(500))
          .field("avatarUrl", UserProfileWrite::avatarUrl, Rules.max(2048))
          .field("identityImageUrl", UserProfileWrite::identityImageUrl, Rules.max(2048))
          .build();
}
