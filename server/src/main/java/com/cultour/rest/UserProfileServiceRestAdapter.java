package com.cultour.rest;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.db.util.UuidUtil;
import com.cultour.model.UserProfileDto;
import com.cultour.model.UserProfileWrite;
import com.cultour.query.ListOptions;
import com.cultour.rest.dto.ApiResponse;
import com.cultour.rest.dto.CreateProfileRequest;
import com.cultour.rest.dto.ErrorResponse;
import com.cultour.rest.dto.UpdateProfileRequest;
import com.cultour.service.UserProfileService;
import com.cultour.storage.BlobUpload;
import com.google.common.io.ByteStreams;
import io.javalin.http.Context;
import io.javalin.http.UploadedFile;
import io.javalin.openapi.HttpMethod;
import io.javalin.openapi.OpenApi;
import io.javalin.openapi.OpenApiContent;
import io.javalin.openapi.OpenApiParam;
import io.javalin.openapi.OpenApiRequestBody;
import io.javalin.openapi.OpenApiResponse;
import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;
import org.tinylog.Logger;

/**
 * REST endpoints for user profiles under {@code /v1/profiles}, plus
 * {@code GET /v1/users/{id}/profile}.
 */
public class UserProfileServiceRestAdapter implements RestAdapter {

  /** Multipart field that carries an uploaded image. */
  static final String IMAGE_FIELD = "image";

  private final UserProfileService profileService;

  public UserProfileServiceRestAdapter(UserProfileService profileService) {
    this.profileService = profileService;
  }

  @OpenApi(
      path = "/v1/profiles",
      methods = {HttpMethod.POST},
      summary = "Create a profile",
      description =
          "Creates the profile of an existing user and grants the explorer badge. A user can have"
              + " one profile.",
      operationId = "createProfile",
      tags = "Profiles",
      requestBody =
          @OpenApiRequestBody(
              required = true,
              content = @OpenApiContent(from = CreateProfileRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "201",
            description = "Profile created",
            content = @OpenApiContent(from = UserProfileDto.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "404",
            description = "User or explorer badge does not exist",
            content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(
            status = "409",
            description = "The user already has a profile",
            content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleCreateProfile(Context ctx) {
    StatusOr<CreateProfileRequest> requestOr = body(ctx, CreateProfileRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }
    CreateProfileRequest request = requestOr.getValue();
    StatusOr<UUID> userIdOr = UuidUtil.fromString(request.userId());
    if (userIdOr.isNotOk()) {
      setError(ctx, userIdOr.getStatus().withContext("userId"));
      return;
    }
    Logger.info("REST CreateProfile request for user {}", userIdOr.getValue());
    UserProfileWrite write =
        new UserProfileWrite(userIdOr.getValue(), request.fullname(), request.bio(), null, null);
    respond(ctx, 201, "Profile created", profileService.createProfile(write));
  }

  @OpenApi(
      path = "/v1/profiles",
      methods = {HttpMethod.GET},
      summary = "List profiles",
      description =
          "Pages through profiles. Filter fields: id, user_id, fullname, bio, avatar_url,"
              + " identity_image_url, created_at, updated_at.",
      operationId = "listProfiles",
      tags = "Profiles",
      queryParams = {
        @OpenApiParam(name = "page", type = Integer.class, example = "1"),
        @OpenApiParam(name = "per_page", type = Integer.class, example = "10"),
        @OpenApiParam(name = "sort_by", type = String.class, example = "fullname"),
        @OpenApiParam(name = "sort_order", type = String.class, example = "asc"),
        @OpenApiParam(name = "filter", type = String.class, example = "fullname:like:sari")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "A page of profiles",
            content = @OpenApiContent(from = ApiResponse.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleListProfiles(Context ctx) {
    StatusOr<ListOptions> optionsOr = ListOptionsParser.parse(ctx);
    if (optionsOr.isNotOk()) {
      setError(ctx, optionsOr.getStatus());
      return;
    }
    respondPage(ctx, "Profiles retrieved", profileService.listProfiles(optionsOr.getValue()));
  }

  @OpenApi(
      path = "/v1/profiles/search",
      methods = {HttpMethod.GET},
      summary = "Search profiles",
      description = "Full-text search over profile names and biographies.",
      operationId = "searchProfiles",
      tags = "Profiles",
      queryParams = {
        @OpenApiParam(name = "search", required = true, type = String.class, example = "batik"),
        @OpenApiParam(name = "page", type = Integer.class, example = "1"),
        @OpenApiParam(name = "per_page", type = Integer.class, example = "10")
      },
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "A page of matching profiles",
            content = @OpenApiContent(from = ApiResponse.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleSearchProfiles(Context ctx) {
    StatusOr<ListOptions> optionsOr = ListOptionsParser.parse(ctx);
    if (optionsOr.isNotOk()) {
      setError(ctx, optionsOr.getStatus());
      return;
    }
    respondPage(ctx, "Profiles found", profileService.searchProfiles(optionsOr.getValue()));
  }

  @OpenApi(
      path = "/v1/profiles/{id}",
      methods = {HttpMethod.GET},
      summary = "Get a profile",
      operationId = "getProfile",
      tags = "Profiles",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The profile",
            content = @OpenApiContent(from = UserProfileDto.class)),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleGetProfile(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    respond(ctx, 200, "Profile retrieved", profileService.getProfile(idOr.getValue()));
  }

  @OpenApi(
      path = "/v1/users/{id}/profile",
      methods = {HttpMethod.GET},
      summary = "Get a user's profile",
      operationId = "getProfileByUser",
      tags = "Profiles",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The user's profile",
            content = @OpenApiContent(from = UserProfileDto.class)),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleGetProfileByUser(Context ctx) {
    StatusOr<UUID> userIdOr = pathId(ctx, "id");
    if (userIdOr.isNotOk()) {
      setError(ctx, userIdOr.getStatus());
      return;
    }
    respond(
        ctx, 200, "Profile retrieved", profileService.getProfileByUserId(userIdOr.getValue()));
  }

  @OpenApi(
      path = "/v1/profiles/{id}",
      methods = {HttpMethod.PUT},
      summary = "Update a profile",
      description = "Changes the name or biography; omitted fields keep their value.",
      operationId = "updateProfile",
      tags = "Profiles",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      requestBody =
          @OpenApiRequestBody(
              required = true,
              content = @OpenApiContent(from = UpdateProfileRequest.class)),
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The updated profile",
            content = @OpenApiContent(from = UserProfileDto.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleUpdateProfile(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    StatusOr<UpdateProfileRequest> requestOr = body(ctx, UpdateProfileRequest.class);
    if (requestOr.isNotOk()) {
      setError(ctx, requestOr.getStatus());
      return;
    }
    respond(
        ctx,
        200,
        "Profile updated",
        profileService.updateProfile(idOr.getValue(), requestOr.getValue().toWrite()));
  }

  @OpenApi(
      path = "/v1/profiles/{id}/avatar",
      methods = {HttpMethod.PUT},
      summary = "Upload a profile avatar",
      description = "Multipart upload in the \"image\" field: JPEG, PNG or WebP, at most 10 MiB.",
      operationId = "updateProfileAvatar",
      tags = "Profiles",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The profile with its new avatar URL",
            content = @OpenApiContent(from = UserProfileDto.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleUpdateAvatar(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    StatusOr<BlobUpload> uploadOr = readImage(ctx);
    if (uploadOr.isNotOk()) {
      setError(ctx, uploadOr.getStatus());
      return;
    }
    respond(
        ctx,
        200,
        "Avatar updated",
        profileService.updateAvatar(idOr.getValue(), uploadOr.getValue()));
  }

  @OpenApi(
      path = "/v1/profiles/{id}/identity",
      methods = {HttpMethod.PUT},
      summary = "Upload an identity document",
      description =
          "Multipart upload in the \"image\" field. Marks the profile as identity-verified and"
              + " grants the verified-local badge.",
      operationId = "verifyProfileIdentity",
      tags = "Profiles",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(
            status = "200",
            description = "The profile with its identity image URL",
            content = @OpenApiContent(from = UserProfileDto.class)),
        @OpenApiResponse(status = "400", content = @OpenApiContent(from = ErrorResponse.class)),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleVerifyIdentity(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    StatusOr<BlobUpload> uploadOr = readImage(ctx);
    if (uploadOr.isNotOk()) {
      setError(ctx, uploadOr.getStatus());
      return;
    }
    Logger.info("REST VerifyIdentity request for profile {}", idOr.getValue());
    respond(
        ctx,
        200,
        "Identity verified",
        profileService.verifyIdentity(idOr.getValue(), uploadOr.getValue()));
  }

  @OpenApi(
      path = "/v1/profiles/{id}",
      methods = {HttpMethod.DELETE},
      summary = "Delete a profile",
      operationId = "deleteProfile",
      tags = "Profiles",
      pathParams = {@OpenApiParam(name = "id", required = true, type = UUID.class)},
      responses = {
        @OpenApiResponse(status = "200", description = "Profile deleted"),
        @OpenApiResponse(status = "404", content = @OpenApiContent(from = ErrorResponse.class))
      })
  public void handleDeleteProfile(Context ctx) {
    StatusOr<UUID> idOr = pathId(ctx, "id");
    if (idOr.isNotOk()) {
      setError(ctx, idOr.getStatus());
      return;
    }
    respondStatus(ctx, "Profile deleted", profileService.deleteProfile(idOr.getValue()));
  }

  private StatusOr<BlobUpload> readImage(Context ctx) {
    UploadedFile file = ctx.uploadedFile(IMAGE_FIELD);
    if (file == null) {
      return StatusOr.ofStatus(
          Status.invalidArgument("multipart field '" + IMAGE_FIELD + "' is required"));
    }
    try (InputStream in = file.content()) {
      return StatusOr.ofValue(
          new BlobUpload(file.filename(), file.contentType(), ByteStreams.toByteArray(in)));
    } catch (IOException e) {
      return StatusOr.ofStatus(Status.internal("failed to read the uploaded file", e));
    }
  }
}
