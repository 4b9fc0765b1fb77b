package com.cultour.rest.dto;

import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;

/** Failure envelope, sent with the HTTP status of the error kind. */
@OpenApiDescription("Envelope returned when a request fails.")
@OpenApiName("ErrorResponse")
public record ErrorResponse(
    @OpenApiDescription("Always false for failed requests.")
    boolean success,

    @OpenApiDescription("Human-readable description of the failure.")
    @OpenApiExample("profile for user 550e8400-e29b-41d4-a716-446655440000 already exists")
    String message,

    @OpenApiDescription(
        "Error kind: INVALID_ARGUMENT, NOT_FOUND, ALREADY_EXISTS, UNAVAILABLE or INTERNAL.")
    @OpenApiExample("ALREADY_EXISTS")
    String error
) {

  public ErrorResponse() {
    this(false, null, null);
  }
}
