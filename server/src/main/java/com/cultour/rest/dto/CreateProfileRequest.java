package com.cultour.rest.dto;

import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;

/** Body of {@code POST /v1/profiles}. */
@OpenApiDescription("Request parameters for creating a user's profile.")
@OpenApiName("CreateProfileRequest")
public record CreateProfileRequest(
    @OpenApiDescription("The user who owns the profile. A user has at most one profile.")
    @OpenApiExample("550e8400-e29b-41d4-a716-446655440000")
    @OpenApiRequired
    String userId,

    @OpenApiDescription("Display name.")
    @OpenApiExample("Sari Wulandari")
    @OpenApiRequired
    String fullname,

    @OpenApiDescription("Short biography.")
    @OpenApiExample("Pecinta batik dan kuliner Yogyakarta.")
    @OpenApiNullable
    String bio
) {

  public CreateProfileRequest() {
    this(null, null, null);
  }
}
