package com.cultour.rest.dto;

import com.cultour.model.UserWrite;
import io.javalin.openapi.OpenApiDescription;
import io.javalin.openapi.OpenApiExample;
import io.javalin.openapi.OpenApiName;
import io.javalin.openapi.OpenApiNullable;
import io.javalin.openapi.OpenApiRequired;

/** Body of {@code POST /v1/users}. */
@OpenApiDescription("Request parameters for registering a user.")
@OpenApiName("CreateUserRequest")
public record CreateUserRequest(
    @OpenApiDescription("Login e-mail address; must not belong to another user.")
    @OpenApiExample("sari@example.com")
    @OpenApiRequired
    String email,

    @OpenApiDescription(
        "At least 8 characters with an uppercase letter, a lowercase letter, a digit"
            + " and a symbol.")
    @OpenApiExample("Rahasia#2024")
    @OpenApiRequired
    String password,

    @OpenApiDescription("Phone number.")
    @OpenApiExample("+628123456789")
    @OpenApiNullable
    String phone,

    @OpenApiDescription("Application role: user, admin or moderator. Defaults to user.")
    @OpenApiExample("user")
    @OpenApiNullable
    String role
) {

  public CreateUserRequest() {
    this(null, null, null, null);
  }

  public UserWrite toWrite() {
    return new UserWrite(email, password, phone, role);
  }
}
