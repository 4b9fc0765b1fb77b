package com.cultour.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import com.cultour.model.UserBadgeDto;
import com.cultour.model.UserBadgeWrite;
import com.cultour.query.QueryDefaults;
import com.cultour.repository.BadgeRepository;
import com.cultour.repository.UserBadgeRepository;
import com.cultour.repository.UserRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UserBadgeServiceTest {

  private UserBadgeRepository userBadges;
  private UserRepository users;
  private BadgeRepository badges;
  private UserBadgeService service;

  private final UUID userId = UUID.randomUUID();
  private final UUID badgeId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    userBadges = mock(UserBadgeRepository.class);
    users = mock(UserRepository.class);
    badges = mock(BadgeRepository.class);
    service =
        new UserBadgeService(
            new UserBadgeService.Config(userBadges, users, badges, QueryDefaults.standard()));
    when(users.exists(userId)).thenReturn(StatusOr.ofValue(true));
    when(badges.exists(badgeId)).thenReturn(StatusOr.ofValue(true));
  }

  private UserBadgeDto grant(UUID user, UUID badge) {
    return new UserBadgeDto(UUID.randomUUID(), user, badge, Instant.now(), null);
  }

  @Test
  void grantingTwiceConflictsAndCreatesOnce() {
    // Given the grant is absent the first time and present the second
    when(userBadges.existsGrant(userId, badgeId))
        .thenReturn(StatusOr.ofValue(false), StatusOr.ofValue(true));
    when(userBadges.create(any())).thenReturn(StatusOr.ofValue(grant(userId, badgeId)));

    // When
    StatusOr<UserBadgeDto> first = service.grantBadge(userId, badgeId);
    StatusOr<UserBadgeDto> second = service.grantBadge(userId, badgeId);

    // Then
    assertTrue(first.isOk());
    assertEquals(StatusCode.ALREADY_EXISTS, second.getStatus().getCode());
    verify(userBadges, times(1)).create(new UserBadgeWrite(userId, badgeId));
  }

  @Test
  void grantRequiresExistingUserAndBadge() {
    UUID ghost = UUID.randomUUID();
    when(users.exists(ghost)).thenReturn(StatusOr.ofValue(false));
    when(badges.exists(ghost)).thenReturn(StatusOr.ofValue(false));

    assertEquals(StatusCode.NOT_FOUND, service.grantBadge(ghost, badgeId).getStatus().getCode());
    assertEquals(StatusCode.NOT_FOUND, service.grantBadge(userId, ghost).getStatus().getCode());
    verify(userBadges, never()).create(any());
  }

  @Test
  void grantRejectsNilIdentifier() {
    StatusOr<UserBadgeDto> result = service.grantBadge(new UUID(0L, 0L), badgeId);

    assertEquals(StatusCode.INVALID_ARGUMENT, result.getStatus().getCode());
    verifyNoInteractions(userBadges);
  }

  @Test
  void bulkGrantStopsAtFirstFailureAndKeepsEarlierGrants() {
    UUID otherBadge = UUID.randomUUID();
    when(badges.exists(otherBadge)).thenReturn(StatusOr.ofValue(true));
    when(userBadges.existsGrant(userId, badgeId)).thenReturn(StatusOr.ofValue(false));
    when(userBadges.existsGrant(userId, otherBadge)).thenReturn(StatusOr.ofValue(true));
    when(userBadges.create(any())).thenReturn(StatusOr.ofValue(grant(userId, badgeId)));

    StatusOr<List<UserBadgeDto>> result =
        service.bulkGrant(
            List.of(
                new UserBadgeWrite(userId, badgeId),
                new UserBadgeWrite(userId, otherBadge),
                new UserBadgeWrite(userId, badgeId)));

    assertEquals(StatusCode.ALREADY_EXISTS, result.getStatus().getCode());
    assertTrue(result.getStatus().getMessage().startsWith("bulk grant stopped at element 1"));
    verify(userBadges, times(1)).create(any());
  }

  @Test
  void bulkGrantValidatesEveryElementFirst() {
    StatusOr<List<UserBadgeDto>> result =
        service.bulkGrant(
            List.of(new UserBadgeWrite(userId, badgeId), new UserBadgeWrite(null, badgeId)));

    assertEquals(StatusCode.INVALID_ARGUMENT, result.getStatus().getCode());
    assertTrue(result.getStatus().getMessage().contains("[1].userId"));
    verifyNoInteractions(userBadges);
  }
}
