package com.cultour.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusCode;
import com.cultour.common.status.StatusOr;
import com.cultour.model.BadgeDto;
import com.cultour.model.BadgeWrite;
import com.cultour.query.QueryDefaults;
import com.cultour.repository.BadgeRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class BadgeServiceTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private BadgeRepository badges;
  private BadgeService service;

  @BeforeEach
  void setUp() {
    badges = mock(BadgeRepository.class);
    service = new BadgeService(new BadgeService.Config(badges, QueryDefaults.standard()));
  }

  private static BadgeDto badge(UUID id, String name, String description) {
    return new BadgeDto(id, name, description, null, NOW, NOW);
  }

  @Test
  void updateKeepsFieldsLeftBlank() {
    // Given {name: "Alpha", description: "B"}
    UUID id = UUID.randomUUID();
    when(badges.findById(id)).thenReturn(StatusOr.ofValue(badge(id, "Alpha", "B")));
    when(badges.update(eq(id), any())).thenReturn(StatusOr.ofValue(badge(id, "Alpha", "C")));

    // When {name: "", description: "C"} is applied
    StatusOr<BadgeDto> updated = service.updateBadge(id, new BadgeWrite("", "C", null));

    // Then {name: "Alpha", description: "C"} is written
    assertTrue(updated.isOk());
    ArgumentCaptor<BadgeWrite> captor = ArgumentCaptor.forClass(BadgeWrite.class);
    verify(badges).update(eq(id), captor.capture());
    assertEquals(new BadgeWrite("Alpha", "C", null), captor.getValue());
    verify(badges, never()).findByName(any());
  }

  @Test
  void renameToTakenNameConflicts() {
    UUID id = UUID.randomUUID();
    when(badges.findById(id)).thenReturn(StatusOr.ofValue(badge(id, "Alpha", "B")));
    when(badges.findByName("Penjelajah"))
        .thenReturn(StatusOr.ofValue(Optional.of(badge(UUID.randomUUID(), "Penjelajah", ""))));

    StatusOr<BadgeDto> updated = service.updateBadge(id, new BadgeWrite("Penjelajah", null, null));

    assertEquals(StatusCode.ALREADY_EXISTS, updated.getStatus().getCode());
    verify(badges, never()).update(any(), any());
  }

  @Test
  void createChecksNameAndValidates() {
    when(badges.findByName("Penjelajah"))
        .thenReturn(StatusOr.ofValue(Optional.of(badge(UUID.randomUUID(), "Penjelajah", ""))));

    assertEquals(
        StatusCode.ALREADY_EXISTS,
        service.createBadge(new BadgeWrite("Penjelajah", null, null)).getStatus().getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.createBadge(new BadgeWrite("ab", null, null)).getStatus().getCode());
    verify(badges, never()).create(any());
  }

  @Test
  void createPassesThroughBackendConflict() {
    // Two creators can both pass the name check; the UNIQUE constraint decides.
    when(badges.findByName("Warlok")).thenReturn(StatusOr.ofValue(Optional.empty()));
    when(badges.create(any()))
        .thenReturn(StatusOr.ofStatus(Status.alreadyExists("badges_name_key")));

    StatusOr<BadgeDto> created = service.createBadge(new BadgeWrite("Warlok", null, null));

    assertEquals(StatusCode.ALREADY_EXISTS, created.getStatus().getCode());
  }

  @Test
  void popularBadgesBoundsLimit() {
    when(badges.findNewest(5)).thenReturn(StatusOr.ofValue(List.of()));

    assertTrue(service.popularBadges(5).isOk());
    assertEquals(StatusCode.INVALID_ARGUMENT, service.popularBadges(0).getStatus().getCode());
    assertEquals(
        StatusCode.INVALID_ARGUMENT,
        service.popularBadges(BadgeService.MAX_POPULAR_BADGES + 1).getStatus().getCode());
  }
}
