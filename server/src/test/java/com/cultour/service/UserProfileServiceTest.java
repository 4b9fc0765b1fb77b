package com.cultour.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import com.cultour.model.BadgeDto;
import com.cultour.model.UserBadgeDto;
import com.cultour.model.UserBadgeWrite;
import com.cultour.model.UserProfileDto;
import com.cultour.model.UserProfileWrite;
import com.cultour.query.ListOptions;
import com.cultour.query.QueryDefaults;
import com.cultour.repository.BadgeRepository;
import com.cultour.repository.UserBadgeRepository;
import com.cultour.repository.UserProfileRepository;
import com.cultour.repository.UserRepository;
import com.cultour.storage.BlobStore;
import com.cultour.storage.BlobUpload;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/** Profile workflows against a real badge awarder and mocked storage. */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class UserProfileServiceTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  @Mock private UserProfileRepository profiles;
  @Mock private UserRepository users;
  @Mock private BadgeRepository badges;
  @Mock private UserBadgeRepository userBadges;
  @Mock private BlobStore blobs;
  private UserProfileService service;

  private final UUID userId = UUID.randomUUID();
  private final UUID profileId = UUID.randomUUID();
  private final BadgeDto explorer =
      new BadgeDto(UUID.randomUUID(), "Penjelajah", "First profile", null, NOW, NOW);
  private final BadgeDto verifiedLocal =
      new BadgeDto(UUID.randomUUID(), "Warlok", "Verified local", null, NOW, NOW);

  @BeforeEach
  void setUp() {
    BadgeAwarder awarder =
        new BadgeAwarder(new BadgeAwarder.Config(BadgeRuleTable.standard(), badges, userBadges));
    service =
        new UserProfileService(
            new UserProfileService.Config(
                profiles, users, awarder, blobs, QueryDefaults.standard(), 1024));

    when(badges.findByName("Penjelajah")).thenReturn(StatusOr.ofValue(Optional.of(explorer)));
    when(badges.findByName("Warlok")).thenReturn(StatusOr.ofValue(Optional.of(verifiedLocal)));
    when(userBadges.existsGrant(any(), any())).thenReturn(StatusOr.ofValue(false));
    when(userBadges.create(any()))
        .thenAnswer(
            invocation -> {
              UserBadgeWrite write = invocation.getArgument(0);
              return StatusOr.ofValue(
                  new UserBadgeDto(UUID.randomUUID(), write.userId(), write.badgeId(), NOW, null));
            });
  }

  private UserProfileDto profile(String fullname, String bio, String identityUrl) {
    return new UserProfileDto(profileId, userId, fullname, bio, null, identityUrl, NOW, NOW, null);
  }

  @Test
  void createProfileForMissingUserIsNotFound() {
    when(users.exists(userId)).thenReturn(StatusOr.ofValue(false));

    StatusOr<UserProfileDto> result =
        service.createProfile(new UserProfileWrite(userId, "Ana Putri", null, null, null));

    assertEquals(StatusCode.NOT_FOUND, result.getStatus().getCode());
    verify(profiles, never()).create(any());
    verify(userBadges, never()).create(any());
  }

  @Test
  void createSecondProfileConflicts() {
    when(users.exists(userId)).thenReturn(StatusOr.ofValue(true));
    when(profiles.existsByUserId(userId)).thenReturn(StatusOr.ofValue(true));

    StatusOr<UserProfileDto> result =
        service.createProfile(new UserProfileWrite(userId, "Ana Putri", null, null, null));

    assertEquals(StatusCode.ALREADY_EXISTS, result.getStatus().getCode());
    verify(profiles, never()).create(any());
    verify(userBadges, never()).create(any());
  }

  @Test
  void createProfileGrantsExplorerBadgeOnce() {
    // Given an existing user without a profile
    when(users.exists(userId)).thenReturn(StatusOr.ofValue(true));
    when(profiles.existsByUserId(userId)).thenReturn(StatusOr.ofValue(false));
    when(profiles.create(any())).thenReturn(StatusOr.ofValue(profile("Ana Putri", null, null)));

    // When
    StatusOr<UserProfileDto> result =
        service.createProfile(new UserProfileWrite(userId, "Ana Putri", "Jogja", null, null));

    // Then exactly one explorer grant is written
    assertTrue(result.isOk());
    verify(userBadges, times(1)).create(any());
    verify(userBadges).create(new UserBadgeWrite(userId, explorer.id()));
  }

  @Test
  void createProfileWithoutExplorerBadgeWritesNothing() {
    when(users.exists(userId)).thenReturn(StatusOr.ofValue(true));
    when(profiles.existsByUserId(userId)).thenReturn(StatusOr.ofValue(false));
    when(badges.findByName("Penjelajah")).thenReturn(StatusOr.ofValue(Optional.empty()));

    StatusOr<UserProfileDto> result =
        service.createProfile(new UserProfileWrite(userId, "Ana Putri", null, null, null));

    assertEquals(StatusCode.NOT_FOUND, result.getStatus().getCode());
    verify(profiles, never()).create(any());
  }

  @Test
  void explorerBadgeAlreadyHeldIsConflict() {
    when(users.exists(userId)).thenReturn(StatusOr.ofValue(true));
    when(profiles.existsByUserId(userId)).thenReturn(StatusOr.ofValue(false));
    when(profiles.create(any())).thenReturn(StatusOr.ofValue(profile("Ana Putri", null, null)));
    when(userBadges.existsGrant(userId, explorer.id())).thenReturn(StatusOr.ofValue(true));

    StatusOr<UserProfileDto> result =
        service.createProfile(new UserProfileWrite(userId, "Ana Putri", null, null, null));

    assertEquals(StatusCode.ALREADY_EXISTS, result.getStatus().getCode());
    verify(profiles).create(any());
    verify(userBadges, never()).create(any());
  }

  @Test
  void failedGrantIsReportedAfterProfileIsCreated() {
    when(users.exists(userId)).thenReturn(StatusOr.ofValue(true));
    when(profiles.existsByUserId(userId)).thenReturn(StatusOr.ofValue(false));
    when(profiles.create(any())).thenReturn(StatusOr.ofValue(profile("Ana Putri", null, null)));
    when(userBadges.create(any()))
        .thenReturn(StatusOr.ofStatus(Status.unavailable("pool exhausted", null)));

    StatusOr<UserProfileDto> result =
        service.createProfile(new UserProfileWrite(userId, "Ana Putri", null, null, null));

    assertEquals(StatusCode.UNAVAILABLE, result.getStatus().getCode());
    verify(profiles).create(any());
  }

  @Test
  void updateProfileMergesBlankFields() {
    // Given {fullname: "A", bio: "B"}
    when(profiles.findById(profileId)).thenReturn(StatusOr.ofValue(profile("A", "B", null)));
    when(profiles.update(eq(profileId), any()))
        .thenReturn(StatusOr.ofValue(profile("A", "C", null)));

    // When {fullname: "", bio: "C"} is applied
    StatusOr<UserProfileDto> result =
        service.updateProfile(profileId, new UserProfileWrite(null, "", "C", null, null));

    // Then {fullname: "A", bio: "C"} is written and the owner is unchanged
    assertTrue(result.isOk());
    ArgumentCaptor<UserProfileWrite> captor = ArgumentCaptor.forClass(UserProfileWrite.class);
    verify(profiles).update(eq(profileId), captor.capture());
    assertEquals(new UserProfileWrite(userId, "A", "C", null, null), captor.getValue());
  }

  @Test
  void verifyIdentityStoresImageAndGrantsVerifiedLocalBadge() {
    when(profiles.findById(profileId)).thenReturn(StatusOr.ofValue(profile("A", "B", null)));
    when(blobs.put(any(), any()))
        .thenReturn(StatusOr.ofValue("https://cdn.cultour.test/images/identity/x.png"));
    when(profiles.update(eq(profileId), any()))
        .thenReturn(
            StatusOr.ofValue(profile("A", "B", "https://cdn.cultour.test/images/identity/x.png")));

    StatusOr<UserProfileDto> result =
        service.verifyIdentity(
            profileId, new BlobUpload("KTP.PNG", "image/png", new byte[] {1, 2, 3}));

    assertTrue(result.isOk());
    assertTrue(result.getValue().isIdentityVerified());
    verify(blobs).put(eq("images/identity/" + userId + ".png"), any());
    verify(userBadges).create(new UserBadgeWrite(userId, verifiedLocal.id()));
  }

  @Test
  void secondIdentityVerificationConflictsOnHeldBadge() {
    // Given grants recorded in memory
    Set<UserBadgeWrite> grants = new HashSet<>();
    when(userBadges.existsGrant(any(), any()))
        .thenAnswer(
            invocation ->
                StatusOr.ofValue(
                    grants.contains(
                        new UserBadgeWrite(invocation.getArgument(0), invocation.getArgument(1)))));
    when(userBadges.create(any()))
        .thenAnswer(
            invocation -> {
              UserBadgeWrite write = invocation.getArgument(0);
              grants.add(write);
              return StatusOr.ofValue(
                  new UserBadgeDto(UUID.randomUUID(), write.userId(), write.badgeId(), NOW, null));
            });
    String url = "https://cdn.cultour.test/images/identity/x.png";
    when(profiles.findById(profileId)).thenReturn(StatusOr.ofValue(profile("A", "B", null)));
    when(blobs.put(any(), any())).thenReturn(StatusOr.ofValue(url));
    when(profiles.update(eq(profileId), any()))
        .thenReturn(StatusOr.ofValue(profile("A", "B", url)));
    BlobUpload image = new BlobUpload("ktp.png", "image/png", new byte[] {1, 2, 3});

    // When
    StatusOr<UserProfileDto> first = service.verifyIdentity(profileId, image);
    StatusOr<UserProfileDto> second = service.verifyIdentity(profileId, image);

    // Then
    assertTrue(first.isOk());
    assertEquals(StatusCode.ALREADY_EXISTS, second.getStatus().getCode());
    assertTrue(second.getStatus().getMessage().startsWith("badge grant for IDENTITY_VERIFIED"));
    assertEquals(1, grants.size());
    verify(profiles, times(2)).update(eq(profileId), any());
  }

  @Test
  void uploadsAreCheckedBeforeStorage() {
    StatusOr<UserProfileDto> tooLarge =
        service.updateAvatar(profileId, new BlobUpload("a.png", "image/png", new byte[2048]));
    StatusOr<UserProfileDto> wrongType =
        service.updateAvatar(profileId, new BlobUpload("a.gif", "image/gif", new byte[] {1}));
    StatusOr<UserProfileDto> empty =
        service.updateAvatar(profileId, new BlobUpload("a.png", "image/png", new byte[0]));

    assertEquals(StatusCode.INVALID_ARGUMENT, tooLarge.getStatus().getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, wrongType.getStatus().getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, empty.getStatus().getCode());
    verifyNoInteractions(blobs);
  }

  @Test
  void searchProfilesRequiresText() {
    StatusOr<?> result = service.searchProfiles(ListOptions.firstPage());
    assertEquals(StatusCode.INVALID_ARGUMENT, result.getStatus().getCode());
    verifyNoInteractions(profiles);
  }
}
