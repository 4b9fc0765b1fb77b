package com.cultour.rest;

import com.cultour.common.status.StatusOr;
import com.cultour.db.util.UuidUtil;
import com.cultour.model.UserBadgeDto;
import com.cultour.rest.dto.ErrorResponse;
import com.cultour.rest.dto.GrantBadgeRequest;
import com.cultour.service.UserBadgeService;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import java.util.UUID;
import org.tinylog.Logger;

/**
 * REST endpoints for badges held by users: {@code /v1/users/{id}/badges} and
 * {@code /v1/user-badges/{id}}.
 */
public class UserBadgeServiceRestAdapter implements RestAdapter {

  private final UserBadgeService userBadgeService;

  public UserBadgeServiceRestAdapter(UserBadgeService userBadgeService) {
    this.userBadgeService = userBadgeService;
  }

  @OpenApi(
      path = "/v1/users/{id}/badges",
      methods = {HttpMethod.GET},
      summary = "List a user's badges",
      operationId = "listUserBadges",
      tags = "User Badges",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The user's badges in the order they were granted",
            content = @OpenApiContent(from = UserBadgeDto[].class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleListUserBadges(Context ctx) {
    StatusOr<UUID> userIdOr = pathId(ctx, "id");
    if (userIdOr.isNotOk()) {
      setError(ctx, userIdOr.getStatus());
      return;
    }
    respond(
        ctx, 200, "User badges retrieved", userBadgeService.listUserBadges(userIdOr.getValue()));
  }

  @OpenApi(
      path = "/v1/users/{id}/badges",
      methods = {HttpMethod.POST},
      summary = "Grant a badge",
      operationId = "grantBadge",
      tags = "User Badges",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      requestBody =
          @OpenApiRequestBody(
              required = true,
              content = @OpenApiContent(from = GrantBadgeRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "201",
            description = "Badge granted",
            content = @OpenApiContent(from = UserBadgeDto.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "404",
            description = "User or badge does not exist",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "409",
            description = "The user already holds the badge",
            content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleGrantBadge(Context ctx) {
    StatusOr<UUID> userIdOr = pathId(ctx, "id");
    if (userIdOr.isNotOk()) {
      setError(ctx, userIdOr.getStatus());
      return;
    }
    StatusOr<GrantBadgeRequest> requestOr = body(ctx, GrantBadgeRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }
    StatusOr<UUID> badgeIdOr = UuidUtil.fromString(requestOr.getValue().badgeId());
    if (badgeIdOr.isNotOk()) {
      setError(ctx, badgeIdOr.getStatus().withContext("badgeId"));
      return;
    }
    Logger.info("REST GrantBadge {} to user {}", badgeIdOr.getValue(), userIdOr.getValue());
    respond(
        ctx,
        201,
        "Badge granted",
        userBadgeService.grantBadge(userIdOr.getValue(), badgeIdOr.getValue()));
  }

  @OpenApi(
      path = "/v1/user-badges/{id}",
      methods = {HttpMethod.GET},
      summary = "Get a badge grant",
      operationId = "getUserBadge",
      tags = "User Badges",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The grant with its badge",
            content = @OpenApiContent(from = UserBadgeDto.class)),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleGetUserBadge(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    respond(ctx, 200, "User badge retrieved", userBadgeService.getUserBadge(idOr.getValue()));
  }

  @OpenApi(
      path = "/v1/user-badges/{id}",
      methods = {HttpMethod.DELETE},
      summary = "Revoke a badge grant",
      operationId = "revokeUserBadge",
      tags = "User Badges",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(status = "200", description = "Grant revoked"),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleRevokeUserBadge(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    respondStatus(ctx, "Badge revoked", userBadgeService.revokeBadge(idOr.getValue()));
  }
}
