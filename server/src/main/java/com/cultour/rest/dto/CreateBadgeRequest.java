package com.cultour.rest.dto;

import com.cultour.model.BadgeWrite;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;

/** Body of {@code POST /v1/badges}. */
@OpenApiDescription("Request parameters for defining a badge.")
@OpenApiName("CreateBadgeRequest")
public record CreateBadgeRequest(
    @OpenApiDescription("Unique badge name, 3 to 100 characters.")
    @OpenApiExample("Penjelajah")
    @OpenApiRequired
    String name,

    @OpenApiDescription("What the badge is awarded for.")
    @OpenApiExample("Awarded when a user creates their profile.")
    @OpenApiNullable
    String description,

    @OpenApiDescription("URL of the badge icon.")
    @OpenApiExample("https://cdn.example.com/badges/penjelajah.png")
    @OpenApiNullable
    String iconUrl
) {

  public CreateBadgeRequest() {
    this(null, null, null);
  }

  public BadgeWrite toWrite() {
    return new BadgeWrite(name, description, iconUrl);
  }
}
