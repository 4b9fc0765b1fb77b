package com.cultour.rest.dto;

import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiRequired;

/** Body of {@code POST /v1/users/{id}/badges}. */
@OpenApiDescription("The badge to grant to the user in the path.")
@OpenApiName("GrantBadgeRequest")
public record GrantBadgeRequest(
    @OpenApiDescription("Identifier of the badge.")
    @OpenApiExample("7c9e6679-7425-40de-944b-e07fc1f90ae7")
    @OpenApiRequired
    String badgeId
) {

  public GrantBadgeRequest() {
    this(null);
  }
}
