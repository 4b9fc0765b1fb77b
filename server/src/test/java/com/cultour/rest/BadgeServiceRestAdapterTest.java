package com.cultour.rest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.model.BadgeDto;
import com.cultour.rest.dto.ApiResponse;
import com.cultour.rest.dto.ErrorResponse;
import com.cultour.service.BadgeService;
import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BadgeServiceRestAdapterTest {

  @Mock private BadgeService badgeService;
  private BadgeServiceRestAdapter adapter;
  @Mock private Context ctx;

  @BeforeEach
  void setUp() {
    adapter = new BadgeServiceRestAdapter(badgeService);
    when(ctx.status(anyInt())).thenReturn(ctx);
    when(ctx.method()).thenReturn(HandlerType.GET);
    when(ctx.path()).thenReturn("/v1/badges");
  }

  @Test
  void getBadgeWrapsResultInEnvelope() {
    // Given
    UUID id = UUID.randomUUID();
    BadgeDto badge = new BadgeDto(id, "Warlok", null, null, Instant.now(), Instant.now());
    when(ctx.pathParam("id")).thenReturn(id.toString());
    when(badgeService.getBadge(id)).thenReturn(StatusOr.ofValue(badge));

    // When
    adapter.handleGetBadge(ctx);

    // Then
    verify(ctx).status(200);
    ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
    verify(ctx).json(body.capture());
    ApiResponse<?> response = (ApiResponse<?>) body.getValue();
    assertTrue(response.success());
    assertSame(badge, response.data());
  }

  @Test
  void malformedIdIsBadRequest() {
    when(ctx.pathParam("id")).thenReturn("not-a-uuid");

    adapter.handleGetBadge(ctx);

    verify(ctx).status(400);
    verifyNoInteractions(badgeService);
  }

  @Test
  void popularUsesDefaultLimit() {
    when(ctx.queryParam("limit")).thenReturn(null);
    when(badgeService.popularBadges(anyInt())).thenReturn(StatusOr.ofValue(List.of()));

    adapter.handlePopularBadges(ctx);

    verify(badgeService).popularBadges(BadgeServiceRestAdapter.DEFAULT_POPULAR_LIMIT);
    verify(ctx).status(200);
  }

  @Test
  void nonNumericPopularLimitIsBadRequest() {
    when(ctx.queryParam("limit")).thenReturn("many");

    adapter.handlePopularBadges(ctx);

    verify(ctx).status(400);
    verify(badgeService, never()).popularBadges(anyInt());
  }

  @Test
  void backendFailureHidesCause() {
    // Given
    UUID id = UUID.randomUUID();
    when(ctx.pathParam("id")).thenReturn(id.toString());
    when(badgeService.getBadge(id))
        .thenReturn(
            StatusOr.ofStatus(
                Status.unavailable("load badge failed: password authentication failed", null)));

    // When
    adapter.handleGetBadge(ctx);

    // Then
    verify(ctx).status(503);
    ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
    verify(ctx).json(body.capture());
    ErrorResponse error = (ErrorResponse) body.getValue();
    assertFalse(error.success());
    assertEquals("UNAVAILABLE", error.error());
    assertFalse(error.message().contains("password"));
  }
}
