package com.cultour.rest.dto;

import com.cultour.model.BadgeWrite;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;

/** Body of {@code PUT /v1/badges/{id}}. */
@OpenApiDescription("Badge fields to change. Omitted or empty fields are left unchanged.")
@OpenApiName("UpdateBadgeRequest")
public record UpdateBadgeRequest(
    @OpenApiDescription("New unique name.")
    @OpenApiNullable
    String name,

    @OpenApiDescription("New description.")
    @OpenApiNullable
    String description,

    @OpenApiDescription("New icon URL.")
    @OpenApiNullable
    String iconUrl
) {

  public UpdateBadgeRequest() {
    this(null, null, null);
  }

  public BadgeWrite toWrite() {
    return new BadgeWrite(name, description, iconUrl);
  }
}
