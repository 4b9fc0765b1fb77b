package com.cultour.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import com.cultour.model.BadgeDto;
import com.cultour.model.UserBadgeDto;
import com.cultour.repository.BadgeRepository;
import com.cultour.repository.UserBadgeRepository;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BadgeAwarderTest {

  @Mock private BadgeRepository badges;
  @Mock private UserBadgeRepository userBadges;
  private final UUID userId = UUID.randomUUID();
  private final BadgeDto explorer =
      new BadgeDto(UUID.randomUUID(), "Penjelajah", null, null, Instant.now(), Instant.now());

  @BeforeEach
  void setUp() {
    when(badges.findByName("Penjelajah")).thenReturn(StatusOr.ofValue(Optional.of(explorer)));
  }

  private BadgeAwarder awarder(BadgeRuleTable rules) {
    return new BadgeAwarder(new BadgeAwarder.Config(rules, badges, userBadges));
  }

  @Test
  void tryGrantConflictsWhenBadgeIsHeld() {
    when(userBadges.existsGrant(userId, explorer.id())).thenReturn(StatusOr.ofValue(true));

    StatusOr<UserBadgeDto> result =
        awarder(BadgeRuleTable.standard()).tryGrant(userId, "Penjelajah");

    assertEquals(StatusCode.ALREADY_EXISTS, result.getStatus().getCode());
    verify(userBadges, never()).create(any());
  }

  @Test
  void tryGrantUnknownBadgeIsNotFound() {
    when(badges.findByName("Nope")).thenReturn(StatusOr.ofValue(Optional.empty()));

    StatusOr<UserBadgeDto> result = awarder(BadgeRuleTable.standard()).tryGrant(userId, "Nope");

    assertEquals(StatusCode.NOT_FOUND, result.getStatus().getCode());
  }

  @Test
  void eventWithoutRuleIsNotFound() {
    BadgeAwarder awarder =
        awarder(BadgeRuleTable.of(Map.of(ProfileEvent.PROFILE_CREATED, "Penjelajah")));

    assertEquals(
        StatusCode.NOT_FOUND,
        awarder.onEvent(ProfileEvent.IDENTITY_VERIFIED, userId).getStatus().getCode());
    assertEquals(
        StatusCode.NOT_FOUND,
        awarder.awardAfter(ProfileEvent.IDENTITY_VERIFIED, userId).getCode());
  }

  @Test
  void awardAfterReportsHeldBadgeAsConflict() {
    when(userBadges.existsGrant(userId, explorer.id())).thenReturn(StatusOr.ofValue(true));

    Status status =
        awarder(BadgeRuleTable.standard()).awardAfter(ProfileEvent.PROFILE_CREATED, userId);

    assertEquals(StatusCode.ALREADY_EXISTS, status.getCode());
    assertTrue(status.getMessage().startsWith("badge grant for PROFILE_CREATED"));
    verify(userBadges, never()).create(any());
  }
}
