package com.cultour.rest.dto;

import com.cultour.model.UserProfileWrite;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;

/** Body of {@code PUT /v1/profiles/{id}}. Images are changed through their own endpoints. */
@OpenApiDescription("Profile fields to change. Omitted or empty fields are left unchanged.")
@OpenApiName("UpdateProfileRequest")
public record UpdateProfileRequest(
    @OpenApiDescription("New display name.")
    @OpenApiExample("Sari W.")
    @OpenApiNullable
    String fullname,

    @OpenApiDescription("New biography.")
    @OpenApiNullable
    String bio
) {

  public UpdateProfileRequest() {
    this(null, null);
  }

  public UserProfileWrite toWrite() {
    return new UserProfileWrite(null, fullname, bio, null, null);
  }
}
