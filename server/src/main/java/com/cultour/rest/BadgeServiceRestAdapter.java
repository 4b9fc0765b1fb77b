package com.cultour.rest;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.model.BadgeDto;
import com.cultour.query.ListOptions;
import com.cultour.rest.dto.ApiResponse;
import com.cultour.rest.dto.CreateBadgeRequest;
import com.cultour.rest.dto.ErrorResponse;
import com.cultour.rest.dto.UpdateBadgeRequest;
import com.cultour.service.BadgeService;
import com.google.common.base.Strings;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import java.util.UUID;

/** REST endpoints for badge definitions under {@code /v1/badges}. */
public class BadgeServiceRestAdapter implements RestAdapter {

  static final int DEFAULT_POPULAR_LIMIT = 10;

  private final BadgeService badgeService;

  public BadgeServiceRestAdapter(BadgeService badgeService) {
    this.badgeService = badgeService;
  }

  @OpenApi(
      path = "/v1/badges",
      methods = {HttpMethod.POST},
      summary = "Define a badge",
      operationId = "createBadge",
      tags = "Badges",
      requestBody =
          @OpenApiRequestBody(
              required = true,
              content = @OpenApiContent(from = CreateBadgeRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "201",
            description = "Badge created",
            content = @OpenApiContent(from = BadgeDto.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "409",
            description = "A badge with this name exists",
            content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleCreateBadge(Context ctx) {
    StatusOr<CreateBadgeRequest> requestOr = body(ctx, CreateBadgeRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }
    respond(ctx, 201, "Badge created", badgeService.createBadge(requestOr.getValue().toWrite()));
  }

  @OpenApi(
      path = "/v1/badges",
      methods = {HttpMethod.GET},
      summary = "List badges",
      description =
          "Pages through badges. Filter fields: id, name, description, icon_url, created_at,"
              + " updated_at; search matches name and description.",
      operationId = "listBadges",
      tags = "Badges",
      queryParams = {
        @OpenApiParam(name = "page", type = Integer.class, example = "1"),
        @OpenApiParam(name = "per_page", type = Integer.class, example = "10"),
        @OpenApiParam(name = "sort_by", type = String.class, example = "name"),
        @OpenApiParam(name = "sort_order", type = String.class, example = "asc"),
        @OpenApiParam(name = "search", type = String.class),
        @OpenApiParam(name = "filter", type = String.class, example = "name:starts_with:Pen")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "A page of badges",
            content = @OpenApiContent(from = ApiResponse.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleListBadges(Context ctx) {
    StatusOr<ListOptions> optionsOr = ListOptionsParser.parse(ctx);
    if (optionsOr.isNotOk()) {
      setError(ctx, optionsOr.getStatus());
      return;
    }
    respondPage(ctx, "Badges retrieved", badgeService.listBadges(optionsOr.getValue()));
  }

  @OpenApi(
      path = "/v1/badges/popular",
      methods = {HttpMethod.GET},
      summary = "Popular badges",
      description = "The most recently created badges.",
      operationId = "popularBadges",
      tags = "Badges",
      queryParams = {@OpenApiParam(name = "limit", type = Integer.class, example = "10")},
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "Badges, newest first",
            content = @OpenApiContent(from = BadgeDto[].class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handlePopularBadges(Context ctx) {
    int limit = DEFAULT_POPULAR_LIMIT;
    String limitParam = ctx.queryParam("limit");
    if (!Strings.isNullOrEmpty(limitParam)) {
      try {
        limit = Integer.parseInt(limitParam.trim());
      } catch (NumberFormatException e) {
        setError(ctx, Status.invalidArgument("limit must be an integer, got '" + limitParam + "'"));
        return;
      }
    }
    respond(ctx, 200, "Popular badges retrieved", badgeService.popularBadges(limit));
  }

  @OpenApi(
      path = "/v1/badges/{id}",
      methods = {HttpMethod.GET},
      summary = "Get a badge",
      operationId = "getBadge",
      tags = "Badges",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The badge",
            content = @OpenApiContent(from = BadgeDto.class)),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleGetBadge(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    respond(ctx, 200, "Badge retrieved", badgeService.getBadge(idOr.getValue()));
  }

  @OpenApi(
      path = "/v1/badges/{id}",
      methods = {HttpMethod.PUT},
      summary = "Update a badge",
      operationId = "updateBadge",
      tags = "Badges",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      requestBody =
          @OpenApiRequestBody(
              required = true,
              content = @OpenApiContent(from = UpdateBadgeRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The updated badge",
            content = @OpenApiContent(from = BadgeDto.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "409", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleUpdateBadge(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    StatusOr<UpdateBadgeRequest> requestOr = body(ctx, UpdateBadgeRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }
    respond(
        ctx,
        200,
        "Badge updated",
        badgeService.updateBadge(idOr.getValue(), requestOr.getValue().toWrite()));
  }

  @OpenApi(
      path = "/v1/badges/{id}",
      methods = {HttpMethod.DELETE},
      summary = "Delete a badge",
      operationId = "deleteBadge",
      tags = "Badges",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(status = "200", description = "Badge deleted"),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleDeleteBadge(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    respondStatus(ctx, "Badge deleted", badgeService.deleteBadge(idOr.getValue()));
  }
}
