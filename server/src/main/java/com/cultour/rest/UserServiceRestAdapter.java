package com.cultour.rest;

import com.cultour.common.status.StatusOr;
import com.cultour.model.UserDto;
import com.cultour.query.ListOptions;
import com.cultour.rest.dto.ApiResponse;
import com.cultour.rest.dto.CreateUserRequest;
import com.cultour.rest.dto.ErrorResponse;
import com.cultour.rest.dto.UpdateUserRequest;
import com.cultour.service.UserService;
import io.javalin.http.Context;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import java.util.UUID;
import org.tinylog.Logger;

/** REST endpoints for user accounts under {@code /v1/users}. */
public class UserServiceRestAdapter implements RestAdapter {

  private final UserService userService;

  public UserServiceRestAdapter(UserService userService) {
    this.userService = userService;
  }

  @OpenApi(
      path = "/v1/users",
      methods = {HttpMethod.POST},
      summary = "Register a user",
      description = "Creates a user in the directory. The role defaults to \"user\".",
      operationId = "createUser",
      tags = "Users",
      requestBody =
          @OpenApiRequestBody(
              required = true,
              content = @OpenApiContent(from = CreateUserRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "201",
            description = "User created",
            content = @OpenApiContent(from = UserDto.class)),
        @OpenApiResponse(
            status = "400",
            description = "Invalid e-mail, password or role",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "409",
            description = "E-mail address already registered",
            content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleCreateUser(Context ctx) {
    StatusOr<CreateUserRequest> requestOr = body(ctx, CreateUserRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }
    Logger.info("REST CreateUser request for {}", requestOr.getValue().email());
    respond(ctx, 201, "User created", userService.createUser(requestOr.getValue().toWrite()));
  }

  @OpenApi(
      path = "/v1/users",
      methods = {HttpMethod.GET},
      summary = "List users",
      description =
          "Pages through users. Filters use filter=field:op:value on id, email, phone, role,"
              + " created_at, updated_at and last_sign_in_at; search matches e-mail and phone.",
      operationId = "listUsers",
      tags = "Users",
      queryParams = {
        @OpenApiParam(name = "page", type = Integer.class, example = "1"),
        @OpenApiParam(name = "per_page", type = Integer.class, example = "10"),
        @OpenApiParam(name = "sort_by", type = String.class, example = "created_at"),
        @OpenApiParam(name = "sort_order", type = String.class, example = "desc"),
        @OpenApiParam(name = "search", type = String.class, example = "example.com"),
        @OpenApiParam(name = "filter", type = String.class, example = "role:eq:admin")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "A page of users",
            content = @OpenApiContent(from = ApiResponse.class)),
        @OpenApiResponse(
            status = "400",
            description = "Unknown filter field, unsupported operator or bad paging value",
            content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleListUsers(Context ctx) {
    StatusOr<ListOptions> optionsOr = ListOptionsParser.parse(ctx);
    if (optionsOr.isNotOk()) {
      setError(ctx, optionsOr.getStatus());
      return;
    }
    respondPage(ctx, "Users retrieved", userService.listUsers(optionsOr.getValue()));
  }

  @OpenApi(
      path = "/v1/users/{id}",
      methods = {HttpMethod.GET},
      summary = "Get a user",
      operationId = "getUser",
      tags = "Users",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The user",
            content = @OpenApiContent(from = UserDto.class)),
        @OpenApiResponse(
            status = "404",
            description = "No such user",
            content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleGetUser(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    respond(ctx, 200, "User retrieved", userService.getUser(idOr.getValue()));
  }

  @OpenApi(
      path = "/v1/users/{id}",
      methods = {HttpMethod.PUT},
      summary = "Update a user",
      description = "Changes the fields present in the body; omitted fields keep their value.",
      operationId = "updateUser",
      tags = "Users",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      requestBody =
          @OpenApiRequestBody(
              required = true,
              content = @OpenApiContent(from = UpdateUserRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The updated user",
            content = @OpenApiContent(from = UserDto.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "409", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleUpdateUser(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    StatusOr<UpdateUserRequest> requestOr = body(ctx, UpdateUserRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }
    respond(
        ctx,
        200,
        "User updated",
        userService.updateUser(idOr.getValue(), requestOr.getValue().toWrite()));
  }

  @OpenApi(
      path = "/v1/users/{id}",
      methods = {HttpMethod.DELETE},
      summary = "Delete a user",
      operationId = "deleteUser",
      tags = "Users",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(status = "200", description = "User deleted"),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleDeleteUser(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    Logger.info("REST DeleteUser request for {}", idOr.getValue());
    respondStatus(ctx, "User deleted", userService.deleteUser(idOr.getValue()));
  }
}
